package com.wmevs.pipeline.config;

import com.wmevs.pipeline.EvPipelineException;

public class ConfigurationException extends EvPipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
