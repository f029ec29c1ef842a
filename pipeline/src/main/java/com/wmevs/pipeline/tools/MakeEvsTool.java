package com.wmevs.pipeline.tools;

import com.wmevs.pipeline.config.ConfigResolver;
import com.wmevs.pipeline.config.PipelineConfig;
import com.wmevs.pipeline.service.EvGenerationService;
import com.wmevs.pipeline.service.SubjectReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Batch tool that writes EV files without starting a Spring context.
 * Usage: MakeEvsTool [--config <file>] [subjectId ...]
 */
public class MakeEvsTool {

    private static final Logger logger = LoggerFactory.getLogger(MakeEvsTool.class);

    public static void main(String[] args) {
        String configPath = null;
        List<String> subjects = new ArrayList<>();
        List<String> argList = Arrays.asList(args);
        for (int i = 0; i < argList.size(); i++) {
            String arg = argList.get(i);
            if ("--config".equals(arg)) {
                if (i + 1 >= argList.size()) {
                    System.err.println("Usage: MakeEvsTool [--config <file>] [subjectId ...]");
                    System.exit(2);
                }
                configPath = argList.get(++i);
            } else {
                subjects.add(arg);
            }
        }

        try {
            PipelineConfig config = configPath != null ? ConfigResolver.load(Paths.get(configPath))
                    : ConfigResolver.resolve();
            EvGenerationService service = new EvGenerationService(config);
            List<SubjectReport> reports = service.run(subjects);
            int files = 0;
            for (SubjectReport report : reports) {
                files += report.getFiles().size();
            }
            logger.info("Done: {} subject(s), {} regressor files", reports.size(), files);
        } catch (Exception e) {
            logger.error("EV generation failed", e);
            System.exit(1);
        }
    }
}
