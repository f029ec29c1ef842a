package com.wmevs.pipeline.design;

import com.wmevs.pipeline.config.ConfigurationException;
import com.wmevs.pipeline.config.PipelineConfig;

public class GlmDesignFactory {

    /**
     * Resolves a design by name (case-insensitive). Unknown names are a
     * configuration error; a different design is never substituted.
     */
    public static GlmDesign create(String name, PipelineConfig config) {
        if (name == null || name.trim().isEmpty()) {
            throw new ConfigurationException("Design name must not be empty");
        }
        switch (name.trim().toUpperCase()) {
            case CuedImageDesign.NAME:
                return new CuedImageDesign(config.imageUniverseSize);
            case MissingPairDesign.NAME:
                return new MissingPairDesign(config.buildPairCatalog(), config.missingPairPostCueRowsOnly);
            default:
                throw new ConfigurationException("Unknown GLM design '" + name + "' (expected "
                        + CuedImageDesign.NAME + " or " + MissingPairDesign.NAME + ")");
        }
    }
}
