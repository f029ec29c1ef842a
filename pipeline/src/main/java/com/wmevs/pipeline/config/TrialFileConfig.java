package com.wmevs.pipeline.config;

/**
 * One behavioural CSV file of a subject. Leading rows are practice trials,
 * trailing rows are end-of-session bookkeeping; both are dropped.
 */
public class TrialFileConfig {
    public String path;
    public int skipLeadingRows = 0;
    public int skipTrailingRows = 0;

    public TrialFileConfig() {
    }

    public TrialFileConfig(String path, int skipLeadingRows, int skipTrailingRows) {
        this.path = path;
        this.skipLeadingRows = skipLeadingRows;
        this.skipTrailingRows = skipTrailingRows;
    }
}
