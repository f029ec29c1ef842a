package com.wmevs.pipeline.trial;

/**
 * When the cue appears relative to the retention interval. Encoded in the trial
 * table as 0 (retro) / 1 (post).
 */
public enum CueType {
    RETRO(0),
    POST(1);

    private final int code;

    CueType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static CueType fromCode(int code) {
        for (CueType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cue type code: " + code);
    }
}
