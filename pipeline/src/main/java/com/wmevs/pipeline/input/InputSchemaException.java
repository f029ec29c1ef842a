package com.wmevs.pipeline.input;

import com.wmevs.pipeline.EvPipelineException;

/**
 * The behavioural input does not have the shape the pipeline needs: missing
 * columns, unparseable cells or a trial count that does not fit the run layout.
 */
public class InputSchemaException extends EvPipelineException {

    public InputSchemaException(String message) {
        super(message);
    }

    public InputSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
