package com.wmevs.pipeline;

/**
 * Base type for every fatal pipeline failure. Unchecked; nothing in the pipeline
 * recovers from these, the current subject is abandoned.
 */
public class EvPipelineException extends RuntimeException {

    public EvPipelineException(String message) {
        super(message);
    }

    public EvPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
