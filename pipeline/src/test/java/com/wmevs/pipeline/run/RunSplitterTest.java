package com.wmevs.pipeline.run;

import com.wmevs.pipeline.input.InputSchemaException;
import com.wmevs.pipeline.timing.TimingNormalizer;
import com.wmevs.pipeline.trial.Trial;
import com.wmevs.pipeline.trial.TrialFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunSplitterTest {

    private final RunSplitter splitter = new RunSplitter(3, new TimingNormalizer(0.5));

    private static List<Trial> classifiedTrials(int count) {
        List<Trial> raw = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            raw.add(TrialFixtures.correctPostCue(i, 3, 7, 50.0 + 10.0 * i));
        }
        return TrialFixtures.defaultClassifier().classifyAll(raw);
    }

    @Test
    public void testSplitsIntoContiguousBlocksNamedByRunOrder() {
        List<Run> runs = splitter.split(classifiedTrials(6), Arrays.asList("11", "09"));

        assertEquals(2, runs.size());
        assertEquals(0, runs.get(0).getIndex());
        assertEquals("11", runs.get(0).getRunId());
        assertEquals("09", runs.get(1).getRunId());
        assertEquals(3, runs.get(1).size());
        assertEquals(3, runs.get(1).trial(0).getOrdinal());
    }

    @Test
    public void testEachRunHasItsOwnTimeBase() {
        List<Run> runs = splitter.split(classifiedTrials(6), Arrays.asList("1", "2"));

        assertEquals(0.0, runs.get(0).timing(0).memoryOnset, 1e-9);
        assertEquals(0.0, runs.get(1).timing(0).memoryOnset, 1e-9);
        assertEquals(20.0, runs.get(1).timing(2).memoryOnset, 1e-9);
    }

    @Test
    public void testTrialCountMustDivideIntoRuns() {
        assertThrows(InputSchemaException.class, () -> splitter.split(classifiedTrials(7), Arrays.asList("1", "2")));
    }

    @Test
    public void testRunOrderListMustMatchRunCount() {
        assertThrows(InputSchemaException.class,
                () -> splitter.split(classifiedTrials(6), Arrays.asList("1", "2", "3")));
    }

    @Test
    public void testUnclassifiedTrialsAreRejected() {
        List<Trial> raw = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            raw.add(TrialFixtures.correctPostCue(i, 3, 7, 10.0 * i));
        }
        assertThrows(IllegalStateException.class, () -> splitter.split(raw, Arrays.asList("1")));
    }
}
