package com.wmevs.pipeline.trial;

public enum Accuracy {
    CORRECT,
    INCORRECT,
    /** No response was given; never imputed either way. */
    UNDEFINED
}
