package com.kpibench.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "entity_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityProfileEntity {

    @Id
    @Column(name = "entity_id", length = 32)
    private String entityId;

    @Column(length = 50)
    private String region;

    @Column(length = 100)
    private String category;
}
