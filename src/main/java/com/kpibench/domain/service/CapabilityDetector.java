package com.kpibench.domain.service;

import com.kpibench.domain.catalog.KpiCatalog;
import com.kpibench.domain.catalog.KpiDefinition;
import com.kpibench.domain.exception.StorageUnavailableException;
import com.kpibench.domain.model.AccessMode;
import com.kpibench.domain.model.BenchmarkStat;
import com.kpibench.domain.model.CapabilitySnapshot;
import com.kpibench.domain.model.KpiValue;
import com.kpibench.domain.model.QueryKind;
import com.kpibench.infrastructure.store.GenerationProbe;
import com.kpibench.infrastructure.store.LineItemStore;
import com.kpibench.infrastructure.store.PrecomputedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Decides, per query kind, where answers come from.
 *
 * Mode Rules:
 * - PRECOMPUTED: the held generation has a readable table for the kind
 * - RAW_FALLBACK: no readable generation but the line-item store answers
 * - UNAVAILABLE: neither; never fatal, re-evaluated on the next detection
 *
 * KPI values and benchmark stats are judged independently. Once a generation
 * is loaded into memory it keeps serving even if its tables later become
 * unreadable, since it is still the published generation.
 *
 * Detection runs at startup, after every publish, on a fixed delay (to pick
 * up generations published by another process) and on the first query after
 * a storage failure marked the snapshot stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapabilityDetector {

    private final PrecomputedStore precomputedStore;
    private final LineItemStore lineItemStore;
    private final GenerationHolder generationHolder;
    private final KpiCatalog catalog;
    private final Clock clock;

    private final AtomicReference<CapabilitySnapshot> snapshot = new AtomicReference<>(CapabilitySnapshot.builder()
            .kpiMode(AccessMode.UNAVAILABLE)
            .benchmarkMode(AccessMode.UNAVAILABLE)
            .build());
    private final AtomicBoolean stale = new AtomicBoolean(true);

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        detect();
    }

    @Scheduled(fixedDelayString = "${app.capability.refresh-interval-ms:60000}",
            initialDelayString = "${app.capability.refresh-interval-ms:60000}")
    public void refresh() {
        detect();
    }

    /**
     * Probe both stores, load a newly published generation if there is one,
     * and recompute the mode of each query kind.
     */
    public synchronized CapabilitySnapshot detect() {
        stale.set(false);
        GenerationIndex index = refreshIndex();
        boolean rawReachable = lineItemStore.isReachable();

        CapabilitySnapshot next = CapabilitySnapshot.builder()
                .kpiMode(modeOf(index != null && index.isKpiValuesReadable(), rawReachable))
                .benchmarkMode(modeOf(index != null && index.isBenchmarkStatsReadable(), rawReachable))
                .generationId(index == null ? null : index.getGenerationId())
                .detectedAt(Instant.now(clock))
                .build();
        CapabilitySnapshot previous = snapshot.getAndSet(next);

        logTransition(QueryKind.KPI_VALUES, previous, next);
        logTransition(QueryKind.BENCHMARKS, previous, next);
        return next;
    }

    /**
     * Mode for a query kind, re-detecting first when a storage failure was reported.
     */
    public AccessMode currentMode(QueryKind kind) {
        if (stale.get()) {
            detect();
        }
        return snapshot.get().modeFor(kind);
    }

    /**
     * Ask for re-detection on the next query.
     */
    public void markStale() {
        if (stale.compareAndSet(false, true)) {
            log.debug("Capability snapshot marked stale");
        }
    }

    private GenerationIndex refreshIndex() {
        GenerationIndex held = generationHolder.current().orElse(null);

        GenerationProbe probe;
        try {
            probe = precomputedStore.probe();
        } catch (StorageUnavailableException e) {
            log.warn("Precomputed store probe failed: {}", e.getMessage());
            return held;
        }
        if (!probe.hasGeneration()) {
            return held;
        }
        long probedId = probe.getGenerationId();
        if (held != null && (held.getGenerationId() > probedId
                || (held.getGenerationId() == probedId && covers(held, probe)))) {
            return held;
        }

        try {
            List<KpiValue> values = probe.isKpiValuesReadable() ? precomputedStore.loadKpiValues(probedId) : null;
            List<BenchmarkStat> stats = probe.isBenchmarkStatsReadable() ? precomputedStore.loadBenchmarkStats(probedId) : null;
            if (values == null && stats == null) {
                log.warn("Generation {} is published but neither table passed the presence check", probedId);
                return held;
            }
            GenerationIndex index = GenerationIndex.of(probedId, values, stats, kpiOrder());
            if (!generationHolder.publish(index)) {
                return generationHolder.current().orElse(held);
            }
            return index;
        } catch (StorageUnavailableException e) {
            log.warn("Could not load generation {}: {}", probedId, e.getMessage());
            return held;
        }
    }

    // Whether the held index already serves every table the probe found readable
    private static boolean covers(GenerationIndex held, GenerationProbe probe) {
        return (held.isKpiValuesReadable() || !probe.isKpiValuesReadable())
                && (held.isBenchmarkStatsReadable() || !probe.isBenchmarkStatsReadable());
    }

    private List<String> kpiOrder() {
        return catalog.definitions().stream().map(KpiDefinition::getKey).toList();
    }

    private static AccessMode modeOf(boolean precomputedReadable, boolean rawReachable) {
        if (precomputedReadable) {
            return AccessMode.PRECOMPUTED;
        }
        return rawReachable ? AccessMode.RAW_FALLBACK : AccessMode.UNAVAILABLE;
    }

    private static void logTransition(QueryKind kind, CapabilitySnapshot previous, CapabilitySnapshot next) {
        AccessMode from = previous.modeFor(kind);
        AccessMode to = next.modeFor(kind);
        if (from != to || previous.getDetectedAt() == null) {
            log.info("{} mode: {} -> {} (generation {})", kind, from, to,
                    next.getGenerationId() == null ? "none" : next.getGenerationId());
        }
    }
}
