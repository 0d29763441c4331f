package com.kpibench.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Peer-group attributes of an entity.
 *
 * Either dimension may be missing; scopes that need a missing
 * dimension simply skip the entity.
 */
@Value
@Builder
public class EntityProfile {

    String entityId;
    String region;
    String category;

    public Optional<String> dimension(ScopeDimension dimension) {
        String value = switch (dimension) {
            case REGION -> region;
            case CATEGORY -> category;
        };
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
