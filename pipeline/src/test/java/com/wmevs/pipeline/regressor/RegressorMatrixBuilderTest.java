package com.wmevs.pipeline.regressor;

import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.ConditionIndexer;
import com.wmevs.pipeline.condition.ResponseFilter;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.run.Run;
import com.wmevs.pipeline.run.RunSplitter;
import com.wmevs.pipeline.timing.TimingNormalizer;
import com.wmevs.pipeline.trial.CueType;
import com.wmevs.pipeline.trial.Trial;
import com.wmevs.pipeline.trial.TrialFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.wmevs.pipeline.trial.TrialFixtures.trial;
import static org.junit.jupiter.api.Assertions.*;

public class RegressorMatrixBuilderTest {

    private final RegressorMatrixBuilder builder = new RegressorMatrixBuilder(new ConditionIndexer());
    private Run run;

    @BeforeEach
    public void setup() {
        List<Trial> raw = Arrays.asList(
                trial(0, 3, 7, CueType.POST, 0, false, "6", 0.84, 20.0, 24.5),
                trial(1, 0, 9, CueType.RETRO, 0, false, "6", 1.23, 30.0, 34.0),
                trial(2, 1, 8, CueType.POST, 0, true, "None", null, 40.0, 44.2));
        List<Trial> classified = TrialFixtures.defaultClassifier().classifyAll(raw);
        run = new RunSplitter(3, new TimingNormalizer(0.5)).split(classified, Collections.singletonList("05")).get(0);
    }

    @Test
    public void testOneRowPerTrialFlagOnlyOnIndexSet() {
        RegressorMatrix matrix = builder.build(run, EventType.MEMORY_ARRAY, Collections.singletonList(1));

        assertEquals(3, matrix.size());
        assertEquals(0, matrix.row(0).flag);
        assertEquals(1, matrix.row(1).flag);
        assertEquals(0, matrix.row(2).flag);
        // onset and duration do not depend on the flag
        assertEquals(0.0, matrix.row(0).onset, 1e-9);
        assertEquals(10.0, matrix.row(1).onset, 1e-9);
        assertEquals(20.0, matrix.row(2).onset, 1e-9);
        for (RegressorRow row : matrix.getRows()) {
            assertEquals(0.5, row.duration, 1e-9);
        }
    }

    @Test
    public void testTestArrayEvent() {
        RegressorMatrix matrix = builder.build(run, EventType.TEST_ARRAY, Collections.emptyList());

        assertEquals(4.5, matrix.row(0).onset, 1e-9);
        assertEquals(0.8, matrix.row(0).duration, 1e-9);
        assertEquals(1.2, matrix.row(1).duration, 1e-9);
        assertEquals(24.2, matrix.row(2).onset, 1e-9);
        assertEquals(0.0, matrix.row(2).duration, 1e-9);
        assertEquals(0, matrix.flaggedCount());
    }

    @Test
    public void testNoResponseConditionSetsOnlyTheFlagColumn() {
        Condition noResponse = new Condition("noresponses", EventType.MEMORY_ARRAY,
                TrialPredicate.response(ResponseFilter.ABSENT));
        RegressorMatrix matrix = builder.build(run, noResponse);

        assertEquals(3, matrix.size());
        assertEquals(1, matrix.flaggedCount());
        assertEquals(1, matrix.row(2).flag);
        assertEquals(20.0, matrix.row(2).onset, 1e-9);
        assertEquals(0.5, matrix.row(2).duration, 1e-9);
    }

    @Test
    public void testRowScopeDropsRows() {
        Condition postOnly = new Condition("postrows", EventType.MEMORY_ARRAY, TrialPredicate.cueType(CueType.POST),
                TrialPredicate.response(ResponseFilter.ABSENT));
        RegressorMatrix matrix = builder.build(run, postOnly);

        assertEquals(2, matrix.size());
        assertEquals(0.0, matrix.row(0).onset, 1e-9);
        assertEquals(0, matrix.row(0).flag);
        assertEquals(20.0, matrix.row(1).onset, 1e-9);
        assertEquals(1, matrix.row(1).flag);
    }

    @Test
    public void testIndexOutsideRunIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(run, EventType.MEMORY_ARRAY, Arrays.asList(0, 3)));
    }
}
