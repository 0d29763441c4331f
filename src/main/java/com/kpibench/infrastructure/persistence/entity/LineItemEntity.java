package com.kpibench.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw financial line-item, written by the upstream refresh and read-only here.
 *
 * Indexing Strategy:
 * - (period, entity_id) for period partitions and per-entity fallback reads
 * - unique (entity_id, period, line_code, column_code) for the key tuple
 */
@Entity
@Table(name = "line_items",
    indexes = {
        @Index(name = "idx_line_item_period_entity", columnList = "period,entity_id")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_line_item_key", columnNames = {"entity_id", "period", "line_code", "column_code"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entity_id", nullable = false, length = 32)
    private String entityId;

    @Column(nullable = false)
    private int period;

    @Column(name = "line_code", nullable = false, length = 32)
    private String lineCode;

    @Column(name = "column_code", nullable = false, length = 32)
    private String columnCode;

    @Column(name = "item_value", nullable = false)
    private double itemValue;
}
