package com.wmevs.pipeline.input;

import com.wmevs.pipeline.config.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names of the trial-table columns the pipeline reads. Defaults are the
 * PsychoPy column names of the cued-recall task.
 */
public class InputSchema {
    public List<String> imageColumns = new ArrayList<>(Arrays.asList(
            "image_1", "image_2", "image_3", "image_4",
            "image_5", "image_6", "image_7", "image_8"));
    public String cueTypeColumn = "retro_0_post_1_real";
    public String cueLocationColumn = "cue_location_real";
    public String changeColumn = "change_or_no_real";
    public String responseKeyColumn = "sd_resp_real.keys";
    public String responseTimeColumn = "sd_resp_real.rt";
    public String memoryOnsetColumn = "array_image_1h.started";
    public String testOnsetColumn = "array_image_1j.started";

    public List<String> requiredColumns() {
        List<String> columns = new ArrayList<>(imageColumns);
        columns.add(cueTypeColumn);
        columns.add(cueLocationColumn);
        columns.add(changeColumn);
        columns.add(responseKeyColumn);
        columns.add(responseTimeColumn);
        columns.add(memoryOnsetColumn);
        columns.add(testOnsetColumn);
        return columns;
    }

    public void validate() {
        if (imageColumns == null || imageColumns.isEmpty()) {
            throw new ConfigurationException("schema.imageColumns must list at least one column");
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String column : requiredColumns()) {
            if (column == null || column.trim().isEmpty()) {
                throw new ConfigurationException("schema has an empty column name");
            }
            if (!seen.add(column)) {
                throw new ConfigurationException("schema binds column '" + column + "' to two fields");
            }
        }
    }
}
