package com.wmevs.pipeline;

import com.wmevs.pipeline.config.ConfigResolver;
import com.wmevs.pipeline.config.PipelineConfig;
import com.wmevs.pipeline.service.EvGenerationService;
import com.wmevs.pipeline.service.SubjectReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Spring Boot entry point. Non-option arguments select subjects; without any,
 * every configured subject is processed.
 */
@SpringBootApplication
public class WmEvsApplication {

    private static final Logger logger = LoggerFactory.getLogger(WmEvsApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WmEvsApplication.class, args);
    }

    @Bean
    public PipelineConfig pipelineConfig() {
        return ConfigResolver.resolve();
    }

    @Bean
    public ApplicationRunner evRunner(EvGenerationService service) {
        return (ApplicationArguments args) -> {
            List<SubjectReport> reports = service.run(args.getNonOptionArgs());
            for (SubjectReport report : reports) {
                logger.info("{}: {} trials in {} runs -> {} regressor files", report.getSubjectId(),
                        report.getTrialCount(), report.getRunCount(), report.getFiles().size());
            }
        };
    }
}
