package com.wmevs.pipeline.config;

import java.util.List;

public class DesignConfig {
    public String name;
    // null enables every condition of the design
    public List<String> enabledConditions;

    public DesignConfig() {
    }

    public DesignConfig(String name, List<String> enabledConditions) {
        this.name = name;
        this.enabledConditions = enabledConditions;
    }
}
