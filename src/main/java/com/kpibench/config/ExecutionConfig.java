package com.kpibench.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

/**
 * Thread pools for the build pipeline and the raw fallback path.
 *
 * Build workers and the build runner are separate pools: the runner blocks
 * on worker futures and must never occupy a worker thread.
 */
@Configuration
public class ExecutionConfig {

    @Bean(name = "buildWorkerExecutor")
    public ThreadPoolTaskExecutor buildWorkerExecutor(@Value("${app.build.parallelism:4}") int parallelism) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("build-worker-");
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "buildJobExecutor")
    public ThreadPoolTaskExecutor buildJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("build-job-");
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "fallbackExecutor")
    public ThreadPoolTaskExecutor fallbackExecutor(@Value("${app.fallback.threads:8}") int threads,
                                                   @Value("${app.fallback.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("raw-fallback-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.initialize();
        return executor;
    }

    @Bean
    public TimeLimiter fallbackTimeLimiter(@Value("${app.fallback.timeout-ms:2000}") long timeoutMs) {
        return TimeLimiter.of("rawFallback", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
    }
}
