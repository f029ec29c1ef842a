package com.wmevs.pipeline.config;

import com.wmevs.pipeline.design.GlmDesignFactory;
import com.wmevs.pipeline.input.InputSchema;
import com.wmevs.pipeline.trial.ImagePairCatalog;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root of {@code wmevs_config.json}. Field defaults describe the cued-recall
 * paradigm the pipeline was built for.
 */
public class PipelineConfig {
    public String dataDirectory = ".";
    public String outputDirectory = "proc_data";
    public boolean overwriteExisting = false;
    public String manifestPath;

    public int trialsPerRun = 50;
    public int runsPerSubject = 15;
    public double memoryRetentionDuration = 0.5;

    public int imageUniverseSize = 10;
    public List<Integer> lowImages = new ArrayList<>(Arrays.asList(0, 1, 2, 3, 4));
    public List<Integer> highImages = new ArrayList<>(Arrays.asList(5, 6, 7, 8, 9));
    public ImagePairCatalog.Mode pairCatalog = ImagePairCatalog.Mode.ALL_PAIRS;
    // GLM2 missing-pair files list only post-cue trials (sparse legacy layout)
    public boolean missingPairPostCueRowsOnly = false;

    public String sameKey = "6";
    public String differentKey = "7";
    public String noResponseKey = "None";

    public String taskStartMarker = "static_instruction_33: autoDraw = True";
    // 0-based column of the event log holding the message text
    public int taskStartMarkerColumn = 2;

    public InputSchema schema = new InputSchema();
    public List<DesignConfig> designs = new ArrayList<>(Arrays.asList(
            new DesignConfig("GLM1", null),
            new DesignConfig("GLM2", null)));
    public List<SubjectConfig> subjects = new ArrayList<>();

    public ImagePairCatalog buildPairCatalog() {
        return ImagePairCatalog.create(pairCatalog, imageUniverseSize, lowImages, highImages);
    }

    public InputSchema schemaFor(SubjectConfig subject) {
        return subject.schema != null ? subject.schema : schema;
    }

    public int runsFor(SubjectConfig subject) {
        return subject.runsPerSubject != null ? subject.runsPerSubject : runsPerSubject;
    }

    public Path resolveDataPath(String path) {
        return Paths.get(dataDirectory).resolve(path);
    }

    public SubjectConfig findSubject(String id) {
        for (SubjectConfig subject : subjects) {
            if (subject.id.equals(id)) {
                return subject;
            }
        }
        throw new ConfigurationException("No subject '" + id + "' in configuration");
    }

    /**
     * Checks the whole configuration up front so that no subject is processed
     * under a configuration that would fail later.
     */
    public void validate() {
        if (trialsPerRun <= 0) {
            throw new ConfigurationException("trialsPerRun must be positive, got " + trialsPerRun);
        }
        if (runsPerSubject <= 0) {
            throw new ConfigurationException("runsPerSubject must be positive, got " + runsPerSubject);
        }
        if (!(memoryRetentionDuration > 0)) {
            throw new ConfigurationException("memoryRetentionDuration must be positive, got " + memoryRetentionDuration);
        }
        if (imageUniverseSize < 2) {
            throw new ConfigurationException("imageUniverseSize must be at least 2, got " + imageUniverseSize);
        }
        validatePartition();
        if (pairCatalog == null) {
            throw new ConfigurationException("pairCatalog must be ALL_PAIRS or LOW_HIGH");
        }
        if (isBlank(sameKey) || isBlank(differentKey) || isBlank(noResponseKey)) {
            throw new ConfigurationException("sameKey, differentKey and noResponseKey must all be set");
        }
        if (new HashSet<>(Arrays.asList(sameKey, differentKey, noResponseKey)).size() != 3) {
            throw new ConfigurationException("sameKey, differentKey and noResponseKey must be distinct");
        }
        if (isBlank(outputDirectory)) {
            throw new ConfigurationException("outputDirectory must be set");
        }
        if (schema == null) {
            throw new ConfigurationException("schema must be set");
        }
        schema.validate();

        if (designs == null || designs.isEmpty()) {
            throw new ConfigurationException("At least one GLM design must be configured");
        }
        Set<String> designNames = new HashSet<>();
        for (DesignConfig design : designs) {
            if (!designNames.add(String.valueOf(design.name).toUpperCase())) {
                throw new ConfigurationException("Design " + design.name + " is configured twice");
            }
            GlmDesignFactory.create(design.name, this).enabledConditions(design.enabledConditions);
        }

        Set<String> subjectIds = new HashSet<>();
        for (SubjectConfig subject : subjects) {
            validateSubject(subject);
            if (!subjectIds.add(subject.id)) {
                throw new ConfigurationException("Subject " + subject.id + " is configured twice");
            }
        }
    }

    private void validatePartition() {
        if (lowImages == null || highImages == null) {
            throw new ConfigurationException("lowImages and highImages must be set");
        }
        Set<Integer> seen = new HashSet<>();
        List<Integer> all = new ArrayList<>(lowImages);
        all.addAll(highImages);
        for (Integer image : all) {
            if (image == null || image < 0 || image >= imageUniverseSize) {
                throw new ConfigurationException("Partition image " + image + " outside universe 0.."
                        + (imageUniverseSize - 1));
            }
            if (!seen.add(image)) {
                throw new ConfigurationException("Image " + image + " appears twice in the low/high partition");
            }
        }
        if (pairCatalog == ImagePairCatalog.Mode.LOW_HIGH && (lowImages.isEmpty() || highImages.isEmpty())) {
            throw new ConfigurationException("LOW_HIGH pair catalog needs non-empty lowImages and highImages");
        }
    }

    private void validateSubject(SubjectConfig subject) {
        if (isBlank(subject.id)) {
            throw new ConfigurationException("Every subject needs an id");
        }
        if (subject.trialFiles == null || subject.trialFiles.isEmpty()) {
            throw new ConfigurationException("Subject " + subject.id + " has no trial files");
        }
        for (TrialFileConfig file : subject.trialFiles) {
            if (isBlank(file.path)) {
                throw new ConfigurationException("Subject " + subject.id + " has a trial file without a path");
            }
            if (file.skipLeadingRows < 0 || file.skipTrailingRows < 0) {
                throw new ConfigurationException("Subject " + subject.id + ": row skips must not be negative");
            }
        }
        int runs = runsFor(subject);
        if (runs <= 0) {
            throw new ConfigurationException("Subject " + subject.id + ": runsPerSubject must be positive");
        }
        if (subject.runIds == null || subject.runIds.size() != runs) {
            throw new ConfigurationException("Subject " + subject.id + " lists "
                    + (subject.runIds == null ? 0 : subject.runIds.size()) + " run ids, expected " + runs);
        }
        if (new HashSet<>(subject.runIds).size() != subject.runIds.size()) {
            throw new ConfigurationException("Subject " + subject.id + " has duplicate run ids " + subject.runIds);
        }
        if (subject.schema != null) {
            subject.schema.validate();
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
