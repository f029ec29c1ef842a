package com.wmevs.pipeline.regressor;

import com.wmevs.pipeline.EvPipelineException;

public class DuplicateOutputException extends EvPipelineException {

    public DuplicateOutputException(EvFileKey key, String detail) {
        super("Regressor file " + key + " " + detail);
    }
}
