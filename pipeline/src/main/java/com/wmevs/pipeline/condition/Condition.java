package com.wmevs.pipeline.condition;

import com.wmevs.pipeline.regressor.EventType;

/**
 * A named regressor definition: which event it times, which trials get a row
 * (the row scope) and which of those rows are flagged.
 */
public class Condition {

    private final String name;
    private final EventType eventType;
    private final TrialPredicate rowScope;
    private final TrialPredicate predicate;

    public Condition(String name, EventType eventType, TrialPredicate predicate) {
        this(name, eventType, TrialPredicate.all(), predicate);
    }

    public Condition(String name, EventType eventType, TrialPredicate rowScope, TrialPredicate predicate) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Condition name must not be blank");
        }
        this.name = name;
        this.eventType = eventType;
        this.rowScope = rowScope;
        this.predicate = predicate;
    }

    public String getName() {
        return name;
    }

    public EventType getEventType() {
        return eventType;
    }

    public TrialPredicate getRowScope() {
        return rowScope;
    }

    public TrialPredicate getPredicate() {
        return predicate;
    }

    @Override
    public String toString() {
        return name + "[" + eventType + "]";
    }
}
