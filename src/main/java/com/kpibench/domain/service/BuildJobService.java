package com.kpibench.domain.service;

import com.kpibench.domain.exception.BuildFailureException;
import com.kpibench.domain.model.BuildReport;
import com.kpibench.infrastructure.persistence.entity.BuildGenerationEntity;
import com.kpibench.infrastructure.persistence.repository.BuildGenerationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Asynchronous build jobs.
 *
 * Processing Flow:
 * 1. Caller submits a build; a RUNNING generation row is created
 * 2. Caller receives the generation id immediately
 * 3. The build runs on the build job thread
 * 4. Caller polls the generation row until it is PUBLISHED or FAILED
 *
 * An optional cron schedule (app.build.cron, disabled by default) submits
 * builds the same way.
 */
@Slf4j
@Service
public class BuildJobService {

    private final BuildPipeline buildPipeline;
    private final BuildGenerationRepository buildGenerationRepository;
    private final ThreadPoolTaskExecutor buildJobExecutor;

    public BuildJobService(BuildPipeline buildPipeline,
                           BuildGenerationRepository buildGenerationRepository,
                           @Qualifier("buildJobExecutor") ThreadPoolTaskExecutor buildJobExecutor) {
        this.buildPipeline = buildPipeline;
        this.buildGenerationRepository = buildGenerationRepository;
        this.buildJobExecutor = buildJobExecutor;
    }

    /**
     * Submit a build and return its generation id.
     *
     * @throws BuildFailureException when a build is already running
     */
    public long submitBuild() {
        long generationId = buildPipeline.begin();
        try {
            buildJobExecutor.execute(() -> {
                BuildReport report = buildPipeline.run(generationId);
                log.info("Build job {} finished: {}", generationId, report.isSucceeded() ? "PUBLISHED" : "FAILED");
            });
        } catch (TaskRejectedException e) {
            buildPipeline.abandon(generationId, "Build job could not be scheduled");
            throw new BuildFailureException(null, null, "Build job could not be scheduled", e);
        }
        log.info("Build job submitted: generation {}", generationId);
        return generationId;
    }

    /**
     * Get the generation row of a build.
     */
    @Transactional(readOnly = true)
    public BuildGenerationEntity getBuildStatus(long generationId) {
        return buildGenerationRepository.findById(generationId)
                .orElseThrow(() -> new IllegalArgumentException("Build not found: " + generationId));
    }

    @Transactional(readOnly = true)
    public List<BuildGenerationEntity> recentBuilds() {
        return buildGenerationRepository.findTop10ByOrderByGenerationIdDesc();
    }

    @Scheduled(cron = "${app.build.cron:-}")
    public void scheduledBuild() {
        try {
            submitBuild();
        } catch (BuildFailureException e) {
            log.warn("Scheduled build skipped: {}", e.getMessage());
        }
    }
}
