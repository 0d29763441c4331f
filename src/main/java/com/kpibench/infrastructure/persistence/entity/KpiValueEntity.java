package com.kpibench.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Precomputed KPI value of one build generation. kpi_value is null when the
 * source data was insufficient.
 */
@Entity
@Table(name = "kpi_values", indexes = {
    @Index(name = "idx_kpi_value_lookup", columnList = "generation_id,entity_id,period"),
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiValueEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "kpi_value_seq")
    @SequenceGenerator(name = "kpi_value_seq", sequenceName = "kpi_value_seq", allocationSize = 500)
    private Long id;

    @Column(name = "generation_id", nullable = false)
    private Long generationId;

    @Column(name = "entity_id", nullable = false, length = 32)
    private String entityId;

    @Column(nullable = false)
    private int period;

    @Column(name = "kpi_key", nullable = false, length = 100)
    private String kpiKey;

    @Column(name = "kpi_value")
    private Double kpiValue;
}
