package com.kpibench.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response model for the entity directory. dataAvailable is false when the
 * line-item store could not be read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EntityListResponse {

    private List<EntitySummary> entities;
    private boolean dataAvailable;
    private Long generation;
    private boolean cached;
    private long queryTimeMs;
}
