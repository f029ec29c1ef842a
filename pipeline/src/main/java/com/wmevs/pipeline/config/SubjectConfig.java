package com.wmevs.pipeline.config;

import com.wmevs.pipeline.input.InputSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything that differs between subjects: input files, the run-order list
 * and, where a session was recorded differently, a schema override.
 */
public class SubjectConfig {
    public String id;
    public List<TrialFileConfig> trialFiles = new ArrayList<>();
    public List<String> eventLogs = new ArrayList<>();
    // 0-based block index -> scanner run identifier
    public List<String> runIds = new ArrayList<>();
    public InputSchema schema;
    public Integer runsPerSubject;
}
