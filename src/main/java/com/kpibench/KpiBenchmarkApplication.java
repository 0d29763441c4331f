package com.kpibench;

import com.kpibench.cli.BuildCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * KPI Benchmark Service
 *
 * Derives per-entity KPI values and peer-group percentile benchmarks from
 * long-format financial line-items and serves them to the reporting layer.
 *
 * Architecture:
 * - Offline build pipeline precomputes every KPI and benchmark into a new generation
 * - Published generations are served from an in-memory index
 * - Raw fallback computes on the fly while no generation is readable
 * - In-process result cache in front of both paths
 *
 * Run with --build to execute one build and exit.
 */
@SpringBootApplication
@EnableScheduling
public class KpiBenchmarkApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(KpiBenchmarkApplication.class);
        if (Arrays.asList(args).contains("--" + BuildCommand.BUILD_OPTION)) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }
}
