package com.wmevs.pipeline.regressor;

public class RegressorRow {

    public final double onset;
    public final double duration;
    // 0 or 1
    public final int flag;

    public RegressorRow(double onset, double duration, int flag) {
        if (flag != 0 && flag != 1) {
            throw new IllegalArgumentException("flag must be 0 or 1, got " + flag);
        }
        this.onset = onset;
        this.duration = duration;
        this.flag = flag;
    }

    @Override
    public String toString() {
        return "[" + onset + ", " + duration + ", " + flag + "]";
    }
}
