package com.kpibench.infrastructure.persistence.entity;

import com.kpibench.domain.model.BuildStage;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One run of the precomputation build pipeline.
 *
 * The id doubles as the generation id stamped on every kpi_values and
 * benchmark_stats row the run writes. Only a PUBLISHED generation is ever
 * named by the published_generation marker.
 */
@Entity
@Table(name = "build_generations", indexes = {
    @Index(name = "idx_generation_status", columnList = "status"),
    @Index(name = "idx_generation_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildGenerationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long generationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column
    private long kpiValueCount;

    @Column
    private long benchmarkStatCount;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private BuildStage failedStage;

    @Column(length = 200)
    private String failedSubject;

    @Column(length = 500)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum Status {
        PENDING,
        RUNNING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        this.status = Status.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markPublished(long kpiValueCount, long benchmarkStatCount) {
        this.status = Status.PUBLISHED;
        this.kpiValueCount = kpiValueCount;
        this.benchmarkStatCount = benchmarkStatCount;
        this.completedAt = Instant.now();
    }

    public void markFailed(BuildStage stage, String subject, String error) {
        this.status = Status.FAILED;
        this.failedStage = stage;
        this.failedSubject = truncate(subject, 200);
        this.errorMessage = truncate(error, 500);
        this.completedAt = Instant.now();
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
