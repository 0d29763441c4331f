package com.kpibench.domain.service;

import com.kpibench.infrastructure.cache.ResultCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the index of the published generation.
 *
 * Swapping is a single atomic update; a reader that already took the
 * previous index keeps using it until its request completes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationHolder {

    private final AtomicReference<GenerationIndex> current = new AtomicReference<>();
    private final ResultCache resultCache;

    public Optional<GenerationIndex> current() {
        return Optional.ofNullable(current.get());
    }

    public Optional<Long> currentGenerationId() {
        return current().map(GenerationIndex::getGenerationId);
    }

    /**
     * Swap in a new generation and drop every cached result of older ones.
     * An index older than the one being served is ignored, so a slow
     * refresh cannot roll the service back past a newer build.
     *
     * @return whether the index was swapped in
     */
    public boolean publish(GenerationIndex index) {
        GenerationIndex previous = current.getAndUpdate(
                held -> held == null || index.getGenerationId() >= held.getGenerationId() ? index : held);
        if (previous != null && index.getGenerationId() < previous.getGenerationId()) {
            log.warn("Ignoring generation {}: already serving {}", index.getGenerationId(),
                    previous.getGenerationId());
            return false;
        }
        resultCache.invalidateAll();
        log.info("Serving generation {} (previous: {})", index.getGenerationId(),
                previous == null ? "none" : previous.getGenerationId());
        return true;
    }
}
