package com.wmevs.pipeline.condition;

public enum ResponseFilter {
    PRESENT,
    ABSENT,
    ANY;

    public boolean matches(boolean responsePresent) {
        switch (this) {
            case PRESENT:
                return responsePresent;
            case ABSENT:
                return !responsePresent;
            default:
                return true;
        }
    }
}
