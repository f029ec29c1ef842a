package com.wmevs.pipeline.design;

import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.config.ConfigurationException;
import com.wmevs.pipeline.regressor.EventType;
import com.wmevs.pipeline.trial.CueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A GLM design is a fixed, ordered set of conditions enumerated for every run.
 * Which of them are written is controlled by an explicit enable-list.
 */
public abstract class GlmDesign {

    public static final String TEST_ARRAY_POST_CUE = "testarraypostcue";
    public static final String TEST_ARRAY_RETRO_CUE = "testarrayretrocue";
    public static final String MEMORY_ARRAY_RETRO_CUE = "memoryarrayretrocue";

    private final String name;
    private List<Condition> conditions;

    protected GlmDesign(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    protected abstract List<Condition> buildConditions();

    public List<Condition> getConditions() {
        if (conditions == null) {
            conditions = Collections.unmodifiableList(buildConditions());
        }
        return conditions;
    }

    /**
     * Conditions named in {@code enabledNames}, in design order. A null list
     * enables every condition.
     */
    public List<Condition> enabledConditions(List<String> enabledNames) {
        if (enabledNames == null) {
            return getConditions();
        }
        Map<String, Condition> byName = new LinkedHashMap<>();
        for (Condition c : getConditions()) {
            byName.put(c.getName(), c);
        }
        for (String enabled : enabledNames) {
            if (!byName.containsKey(enabled)) {
                throw new ConfigurationException("Design " + name + " has no condition named '" + enabled + "'");
            }
        }
        List<Condition> result = new ArrayList<>();
        for (Condition c : getConditions()) {
            if (enabledNames.contains(c.getName())) {
                result.add(c);
            }
        }
        return result;
    }

    // Cue-type onset regressors shared by both designs.
    protected static List<Condition> cueTypeConditions() {
        List<Condition> list = new ArrayList<>();
        list.add(new Condition(TEST_ARRAY_POST_CUE, EventType.TEST_ARRAY, TrialPredicate.cueType(CueType.POST)));
        list.add(new Condition(TEST_ARRAY_RETRO_CUE, EventType.TEST_ARRAY, TrialPredicate.cueType(CueType.RETRO)));
        list.add(new Condition(MEMORY_ARRAY_RETRO_CUE, EventType.MEMORY_ARRAY,
                TrialPredicate.cueType(CueType.RETRO)));
        return list;
    }
}
