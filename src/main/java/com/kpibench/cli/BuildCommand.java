package com.kpibench.cli;

import com.kpibench.domain.exception.BuildFailureException;
import com.kpibench.domain.model.BuildReport;
import com.kpibench.domain.service.BuildPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot build from the command line.
 *
 * Usage: java -jar kpi-benchmark-service.jar --build
 *
 * Runs one build, logs the report and exits with 0 when the generation was
 * published and 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BuildCommand implements ApplicationRunner {

    public static final String BUILD_OPTION = "build";

    private final BuildPipeline buildPipeline;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(BUILD_OPTION)) {
            return;
        }
        int exitCode = runBuild();
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }

    int runBuild() {
        BuildReport report;
        try {
            report = buildPipeline.build();
        } catch (BuildFailureException e) {
            log.error("Build not started: {}", e.getMessage());
            return 1;
        }

        if (report.isSucceeded()) {
            log.info("Build report: generation {} PUBLISHED, {} KPI values, {} benchmark stats, {} ms",
                    report.getGenerationId(), report.getKpiValueCount(), report.getBenchmarkStatCount(),
                    report.getElapsedMs());
        } else {
            log.error("Build report: generation {} FAILED in {} (subject: {}): {}",
                    report.getGenerationId(), report.getFailedStage(), report.getFailedSubject(),
                    report.getMessage());
        }
        return report.exitCode();
    }
}
