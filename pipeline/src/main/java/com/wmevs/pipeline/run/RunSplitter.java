package com.wmevs.pipeline.run;

import com.wmevs.pipeline.input.InputSchemaException;
import com.wmevs.pipeline.timing.TimingNormalizer;
import com.wmevs.pipeline.trial.Trial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a classified trial sequence into fixed-length runs. The i-th block is
 * named with the i-th entry of the supplied run-order list; identifiers are
 * never derived.
 */
public class RunSplitter {

    private static final Logger logger = LoggerFactory.getLogger(RunSplitter.class);

    private final int trialsPerRun;
    private final TimingNormalizer timingNormalizer;

    public RunSplitter(int trialsPerRun, TimingNormalizer timingNormalizer) {
        if (trialsPerRun <= 0) {
            throw new IllegalArgumentException("trialsPerRun must be positive");
        }
        this.trialsPerRun = trialsPerRun;
        this.timingNormalizer = timingNormalizer;
    }

    public List<Run> split(List<Trial> trials, List<String> runIds) {
        if (trials.size() % trialsPerRun != 0) {
            throw new InputSchemaException(trials.size() + " trials do not divide into runs of " + trialsPerRun);
        }
        int runCount = trials.size() / trialsPerRun;
        if (runCount != runIds.size()) {
            throw new InputSchemaException(trials.size() + " trials make " + runCount + " runs of " + trialsPerRun
                    + " but the run-order list names " + runIds.size());
        }
        for (Trial trial : trials) {
            if (!trial.isClassified()) {
                throw new IllegalStateException("Trial " + trial.getOrdinal() + " must be classified before runs are cut");
            }
        }

        List<Run> runs = new ArrayList<>(runCount);
        for (int block = 0; block < runCount; block++) {
            List<Trial> blockTrials = trials.subList(block * trialsPerRun, (block + 1) * trialsPerRun);
            Run run = new Run(block, runIds.get(block), blockTrials, timingNormalizer.normalize(blockTrials));
            logger.debug("Cut run {} (index {}) from trials {}..{}", run.getRunId(), block,
                    blockTrials.get(0).getOrdinal(), blockTrials.get(blockTrials.size() - 1).getOrdinal());
            runs.add(run);
        }
        return runs;
    }

    public int getTrialsPerRun() {
        return trialsPerRun;
    }
}
