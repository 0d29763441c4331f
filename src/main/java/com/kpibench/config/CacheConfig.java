package com.kpibench.config;

import com.kpibench.infrastructure.cache.ResultCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Result cache and the clock it expires entries against.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(@Value("${app.cache.max-size:10000}") int maxSize,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        ResultCache cache = new ResultCache(maxSize, clock);
        Gauge.builder("result.cache.size", cache, ResultCache::size)
                .description("Entries held by the query result cache")
                .register(meterRegistry);
        log.info("Result cache: {} entries max", cache.maxSize());
        return cache;
    }
}
