package com.wmevs.pipeline.regressor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Onset/duration/flag rows of one condition in one run, one row per trial in
 * the condition's row scope.
 */
public class RegressorMatrix {

    private final List<RegressorRow> rows;

    public RegressorMatrix(List<RegressorRow> rows) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<RegressorRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public RegressorRow row(int i) {
        return rows.get(i);
    }

    public int flaggedCount() {
        int count = 0;
        for (RegressorRow row : rows) {
            count += row.flag;
        }
        return count;
    }
}
