package com.kpibench.api;

import com.kpibench.domain.model.CapabilitySnapshot;
import com.kpibench.domain.service.BuildJobService;
import com.kpibench.domain.service.CapabilityDetector;
import com.kpibench.infrastructure.cache.ResultCache;
import com.kpibench.infrastructure.persistence.entity.BuildGenerationEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints.
 *
 * Endpoints:
 * - POST /api/v1/admin/builds - submit an asynchronous build
 * - GET /api/v1/admin/builds - the ten most recent builds
 * - GET /api/v1/admin/builds/{generationId} - build status
 * - GET /api/v1/admin/capabilities - re-detect and return the current modes
 * - GET /api/v1/admin/cache - result cache statistics
 * - DELETE /api/v1/admin/cache - clear the result cache
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final BuildJobService buildJobService;
    private final CapabilityDetector capabilityDetector;
    private final ResultCache resultCache;

    /**
     * Response:
     * {
     *   "generationId": 42
     * }
     */
    @PostMapping("/builds")
    public ResponseEntity<Map<String, Long>> submitBuild() {
        log.info("Submit build");
        long generationId = buildJobService.submitBuild();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("generationId", generationId));
    }

    @GetMapping("/builds")
    public ResponseEntity<List<BuildGenerationEntity>> recentBuilds() {
        return ResponseEntity.ok(buildJobService.recentBuilds());
    }

    /**
     * Status is one of PENDING | RUNNING | PUBLISHED | FAILED; a failed build
     * names the stage and subject it failed on.
     */
    @GetMapping("/builds/{generationId}")
    public ResponseEntity<BuildGenerationEntity> getBuildStatus(@PathVariable long generationId) {
        log.info("Get build status: generationId={}", generationId);
        return ResponseEntity.ok(buildJobService.getBuildStatus(generationId));
    }

    @GetMapping("/capabilities")
    public ResponseEntity<CapabilitySnapshot> capabilities() {
        return ResponseEntity.ok(capabilityDetector.detect());
    }

    @GetMapping("/cache")
    public ResponseEntity<ResultCache.CacheStats> cacheStats() {
        return ResponseEntity.ok(resultCache.stats());
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache() {
        log.info("Clear result cache");
        resultCache.invalidateAll();
        return ResponseEntity.noContent().build();
    }
}
