package com.kpibench.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Single-row marker naming the currently published generation.
 * Updating it is the only step that makes a build visible.
 */
@Entity
@Table(name = "published_generation")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishedGenerationEntity {

    public static final String CURRENT = "current";

    @Id
    @Column(name = "marker_id", length = 20)
    private String markerId;

    @Column(name = "generation_id", nullable = false)
    private Long generationId;

    @Column(name = "published_at", nullable = false)
    private Instant publishedAt;
}
