package com.kpibench.api;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.model.BenchmarkQueryResponse;
import com.kpibench.domain.model.EntityBenchmarkResponse;
import com.kpibench.domain.model.EntityListResponse;
import com.kpibench.domain.model.KpiHistoryResponse;
import com.kpibench.domain.model.KpiQueryResponse;
import com.kpibench.domain.model.KpiTreeNode;
import com.kpibench.domain.service.QueryRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for KPI and benchmark queries.
 *
 * Endpoints:
 * - GET /api/v1/entities - entities that report line-items
 * - GET /api/v1/kpis/{entityId} - KPI values of one entity for every reported period
 * - GET /api/v1/kpis/{entityId}/{period} - KPI values of one entity
 * - GET /api/v1/kpis/{entityId}/{period}/benchmarks?scope= - the entity's peer-group benchmarks
 * - GET /api/v1/kpis/tree - KPI hierarchy
 * - GET /api/v1/benchmarks?kpi=&scope=&scopeKey=&period= - one partition's benchmark
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class KpiController {

    private final QueryRouter queryRouter;
    private final KpiCatalog catalog;

    @GetMapping("/entities")
    public ResponseEntity<EntityListResponse> getEntities() {
        log.info("List entities");
        return ResponseEntity.ok(queryRouter.listEntities());
    }

    /**
     * KPI values of one entity for every period it reported, oldest first.
     * The literal /kpis/tree mapping takes precedence over this one.
     */
    @GetMapping("/kpis/{entityId}")
    public ResponseEntity<KpiHistoryResponse> getKpiHistory(@PathVariable String entityId) {
        log.info("Query KPI history: entityId={}", entityId);
        return ResponseEntity.ok(queryRouter.getKpiHistory(entityId));
    }

    /**
     * KPI values of one entity and period.
     *
     * Response:
     * - values: KPI key to value, null where the KPI could not be computed
     * - provenance: PRECOMPUTED | RAW_FALLBACK | UNAVAILABLE
     * - dataAvailable: false for an unknown entity/period or when nothing could be served
     * - generation, cached, queryTimeMs
     */
    @GetMapping("/kpis/{entityId}/{period}")
    public ResponseEntity<KpiQueryResponse> getKpis(@PathVariable String entityId, @PathVariable int period) {
        log.info("Query KPIs: entityId={}, period={}", entityId, period);
        return ResponseEntity.ok(queryRouter.getKpis(entityId, period));
    }

    /**
     * Benchmarks of every KPI for the partition of {@code scope} the entity belongs to.
     */
    @GetMapping("/kpis/{entityId}/{period}/benchmarks")
    public ResponseEntity<EntityBenchmarkResponse> getEntityBenchmarks(
            @PathVariable String entityId,
            @PathVariable int period,
            @RequestParam(defaultValue = "all") String scope) {

        log.info("Query entity benchmarks: entityId={}, period={}, scope={}", entityId, period, scope);
        return ResponseEntity.ok(queryRouter.getEntityBenchmarks(entityId, period, scope));
    }

    /**
     * Benchmark of one KPI for one partition; an absent partition answers with stat = null.
     */
    @GetMapping("/benchmarks")
    public ResponseEntity<BenchmarkQueryResponse> getBenchmarks(
            @RequestParam String kpi,
            @RequestParam String scope,
            @RequestParam String scopeKey,
            @RequestParam int period) {

        log.info("Query benchmarks: kpi={}, scope={}, scopeKey={}, period={}", kpi, scope, scopeKey, period);
        return ResponseEntity.ok(queryRouter.getBenchmarks(kpi, scope, scopeKey, period));
    }

    @GetMapping("/kpis/tree")
    public ResponseEntity<List<KpiTreeNode>> getTree() {
        return ResponseEntity.ok(catalog.roots().stream().map(this::toNode).toList());
    }

    private KpiTreeNode toNode(KpiDefinition definition) {
        return KpiTreeNode.builder()
                .key(definition.getKey())
                .name(definition.getName())
                .level(definition.getLevel())
                .unit(definition.getUnit())
                .higherIsBetter(definition.isHigherIsBetter())
                .mapped(!definition.isUnmapped())
                .formula(definition.isUnmapped() ? null : definition.getFormula().getSource())
                .lineage(catalog.lineage(definition.getKey()).stream().map(KpiDefinition::getKey).toList())
                .children(catalog.children(definition.getKey()).stream().map(this::toNode).toList())
                .build();
    }
}
