package com.wmevs.pipeline.service;

import com.wmevs.db.EvManifestDao;
import com.wmevs.db.SqliteInitializer;
import com.wmevs.pipeline.EvPipelineException;
import com.wmevs.pipeline.condition.Condition;
import com.wmevs.pipeline.condition.ConditionIndexer;
import com.wmevs.pipeline.condition.TrialPredicate;
import com.wmevs.pipeline.config.DesignConfig;
import com.wmevs.pipeline.config.PipelineConfig;
import com.wmevs.pipeline.config.SubjectConfig;
import com.wmevs.pipeline.design.GlmDesign;
import com.wmevs.pipeline.design.GlmDesignFactory;
import com.wmevs.pipeline.input.EventLogReader;
import com.wmevs.pipeline.input.InputSchemaException;
import com.wmevs.pipeline.input.TrialTableReader;
import com.wmevs.pipeline.regressor.EvFileKey;
import com.wmevs.pipeline.regressor.RegressorFileEmitter;
import com.wmevs.pipeline.regressor.RegressorMatrix;
import com.wmevs.pipeline.regressor.RegressorMatrixBuilder;
import com.wmevs.pipeline.run.Run;
import com.wmevs.pipeline.run.RunSplitter;
import com.wmevs.pipeline.timing.TimingNormalizer;
import com.wmevs.pipeline.trial.CueType;
import com.wmevs.pipeline.trial.Trial;
import com.wmevs.pipeline.trial.TrialClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns each configured subject's trial tables into GLM regressor files.
 *
 * Per subject: read and check all input, classify every trial, cut runs in
 * run-order-list order, then for every run emit each enabled condition of
 * each configured design.
 */
@Service
public class EvGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(EvGenerationService.class);

    private final PipelineConfig config;
    private final TrialClassifier classifier;
    private final ConditionIndexer indexer = new ConditionIndexer();
    private final RegressorMatrixBuilder matrixBuilder = new RegressorMatrixBuilder(indexer);
    private final Map<GlmDesign, List<Condition>> designs = new LinkedHashMap<>();
    private final EvManifestDao manifest;

    public EvGenerationService(PipelineConfig config) {
        config.validate();
        this.config = config;
        this.classifier = TrialClassifier.fromConfig(config);
        for (DesignConfig dc : config.designs) {
            GlmDesign design = GlmDesignFactory.create(dc.name, config);
            designs.put(design, design.enabledConditions(dc.enabledConditions));
        }
        this.manifest = openManifest(config.manifestPath);
    }

    public List<SubjectReport> runAll() {
        List<SubjectReport> reports = new ArrayList<>();
        for (SubjectConfig subject : config.subjects) {
            reports.add(runSubject(subject));
        }
        return reports;
    }

    public List<SubjectReport> run(List<String> subjectIds) {
        if (subjectIds == null || subjectIds.isEmpty()) {
            return runAll();
        }
        List<SubjectReport> reports = new ArrayList<>();
        for (String id : subjectIds) {
            reports.add(runSubject(config.findSubject(id)));
        }
        return reports;
    }

    public SubjectReport runSubject(SubjectConfig subject) {
        logger.info("Processing subject {}", subject.id);
        TrialTableReader reader = new TrialTableReader(config.schemaFor(subject));
        List<Trial> trials = reader.read(subject.trialFiles, config::resolveDataPath);

        int runs = config.runsFor(subject);
        int expected = config.trialsPerRun * runs;
        if (trials.size() != expected) {
            throw new InputSchemaException("Subject " + subject.id + " has " + trials.size()
                    + " trials after trimming, expected " + expected + " (" + runs + " runs of "
                    + config.trialsPerRun + ")");
        }
        checkEventLogs(subject);

        return generate(subject.id, trials, subject.runIds);
    }

    /**
     * Core pipeline for one subject, independent of where the trials came from.
     */
    public SubjectReport generate(String subjectId, List<Trial> rawTrials, List<String> runIds) {
        List<Trial> trials = classifier.classifyAll(rawTrials);

        RunSplitter splitter = new RunSplitter(config.trialsPerRun,
                new TimingNormalizer(config.memoryRetentionDuration));
        List<Run> runs = splitter.split(trials, runIds);

        RegressorFileEmitter emitter = new RegressorFileEmitter(Paths.get(config.outputDirectory),
                config.overwriteExisting, manifest);
        List<Path> written = new ArrayList<>();
        for (Run run : runs) {
            if (indexer.indicesOf(run, TrialPredicate.cueType(CueType.POST)).isEmpty()) {
                logger.warn("Subject {} run {} has no post-cue trials", subjectId, run.getRunId());
            }
            for (Map.Entry<GlmDesign, List<Condition>> entry : designs.entrySet()) {
                String designName = entry.getKey().getName();
                for (Condition condition : entry.getValue()) {
                    RegressorMatrix matrix = matrixBuilder.build(run, condition);
                    EvFileKey key = new EvFileKey(subjectId, designName, run.getRunId(), condition.getName());
                    written.add(emitter.emit(key, matrix));
                }
            }
            logger.info("Subject {} run {}: {} trials, regressor files written", subjectId, run.getRunId(),
                    run.size());
        }

        logger.info("Subject {} done: {} runs, {} files", subjectId, runs.size(), written.size());
        logManifestCount(subjectId);
        return new SubjectReport(subjectId, trials.size(), runs.size(), written);
    }

    private void checkEventLogs(SubjectConfig subject) {
        if (subject.eventLogs == null || subject.eventLogs.isEmpty()) {
            return;
        }
        EventLogReader logReader = new EventLogReader(config.taskStartMarker, config.taskStartMarkerColumn);
        int events = 0;
        for (String log : subject.eventLogs) {
            events += logReader.readTaskEvents(config.resolveDataPath(log)).size();
        }
        logger.info("Subject {}: {} main-task events across {} event log(s)", subject.id, events,
                subject.eventLogs.size());
    }

    private void logManifestCount(String subjectId) {
        if (manifest == null) {
            return;
        }
        try {
            logger.info("Manifest now holds {} files for subject {}", manifest.countBySubject(subjectId), subjectId);
        } catch (SQLException e) {
            throw new EvPipelineException("Failed to read EV manifest", e);
        }
    }

    private static EvManifestDao openManifest(String manifestPath) {
        if (manifestPath == null || manifestPath.isEmpty()) {
            return null;
        }
        try {
            Path parent = Paths.get(manifestPath).toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SqliteInitializer.initialize(manifestPath);
            logger.info("Initialized EV manifest at {}", manifestPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory for EV manifest " + manifestPath, e);
        } catch (SQLException e) {
            throw new EvPipelineException("Failed to initialize EV manifest at " + manifestPath, e);
        }
        return new EvManifestDao(manifestPath);
    }
}
