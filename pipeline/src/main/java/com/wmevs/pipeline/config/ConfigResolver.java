package com.wmevs.pipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConfigResolver.class);

    public static final String CONFIG_PROPERTY = "wmevs.config";
    public static final String DEFAULT_RESOURCE = "/wmevs_config.json";

    public static PipelineConfig resolve() {
        // 1. System property
        String sysProp = System.getProperty(CONFIG_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return load(Paths.get(sysProp));
        }

        // 2. Classpath default
        try (InputStream is = ConfigResolver.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new ConfigurationException("No -D" + CONFIG_PROPERTY + " given and " + DEFAULT_RESOURCE
                        + " is not on the classpath");
            }
            logger.info("Loading configuration from classpath {}", DEFAULT_RESOURCE);
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static PipelineConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        logger.info("Loading configuration from {}", path.toAbsolutePath());
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
    }

    public static PipelineConfig load(InputStream jsonStream) {
        PipelineConfig config;
        try {
            ObjectMapper mapper = new ObjectMapper();
            config = mapper.readValue(jsonStream, PipelineConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
        }
        config.validate();
        return config;
    }
}
