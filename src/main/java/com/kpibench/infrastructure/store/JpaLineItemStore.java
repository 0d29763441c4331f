package com.kpibench.infrastructure.store;

import com.kpibench.domain.exception.StorageUnavailableException;
import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.EntitySummary;
import com.kpibench.domain.model.LineItem;
import com.kpibench.infrastructure.persistence.entity.EntityProfileEntity;
import com.kpibench.infrastructure.persistence.entity.LineItemEntity;
import com.kpibench.infrastructure.persistence.repository.EntityProfileRepository;
import com.kpibench.infrastructure.persistence.repository.LineItemRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Line-item store backed by the line_items / entity_profiles tables.
 *
 * Failure Handling:
 * - Circuit breaker "lineItemStore" stops hammering an unreachable database
 * - Every fallback surfaces as StorageUnavailableException so callers can
 *   downgrade instead of failing
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaLineItemStore implements LineItemStore {

    private final LineItemRepository lineItemRepository;
    private final EntityProfileRepository entityProfileRepository;

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "periodsFallback")
    public List<Integer> periods() {
        return lineItemRepository.findDistinctPeriods();
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "entitiesFallback")
    public List<EntitySummary> entities() {
        Map<String, EntityProfile> profiles = profiles();
        List<EntitySummary> entities = new ArrayList<>();
        for (Object[] row : lineItemRepository.summarizeEntities()) {
            String entityId = (String) row[0];
            EntityProfile profile = profiles.get(entityId);
            entities.add(EntitySummary.builder()
                    .entityId(entityId)
                    .region(profile != null ? profile.getRegion() : null)
                    .category(profile != null ? profile.getCategory() : null)
                    .periodCount(((Number) row[1]).intValue())
                    .firstPeriod(((Number) row[2]).intValue())
                    .latestPeriod(((Number) row[3]).intValue())
                    .build());
        }
        log.debug("Listed {} entities", entities.size());
        return entities;
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "findByPeriodFallback")
    public List<LineItem> findByPeriod(int period) {
        List<LineItem> items = toLineItems(lineItemRepository.findByPeriod(period));
        log.debug("Loaded {} line-items for period {}", items.size(), period);
        return items;
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "findByEntityFallback")
    public List<LineItem> findByEntity(String entityId, Collection<Integer> periods) {
        return toLineItems(lineItemRepository.findByEntityIdAndPeriodIn(entityId, periods));
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "findByEntitiesFallback")
    public List<LineItem> findByEntities(Collection<String> entityIds, Collection<Integer> periods) {
        if (entityIds.isEmpty() || periods.isEmpty()) {
            return List.of();
        }
        return toLineItems(lineItemRepository.findByPeriodsAndEntities(periods, entityIds));
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "profilesFallback")
    public Map<String, EntityProfile> profiles() {
        Map<String, EntityProfile> profiles = new LinkedHashMap<>();
        for (EntityProfileEntity entity : entityProfileRepository.findAll()) {
            profiles.put(entity.getEntityId(), toProfile(entity));
        }
        return profiles;
    }

    @Override
    @Transactional(readOnly = true)
    @CircuitBreaker(name = "lineItemStore", fallbackMethod = "profileFallback")
    public Optional<EntityProfile> profile(String entityId) {
        return entityProfileRepository.findById(entityId).map(JpaLineItemStore::toProfile);
    }

    @Override
    public boolean isReachable() {
        try {
            lineItemRepository.count();
            return true;
        } catch (DataAccessException e) {
            log.warn("Line-item store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private static EntityProfile toProfile(EntityProfileEntity entity) {
        return EntityProfile.builder()
                .entityId(entity.getEntityId())
                .region(entity.getRegion())
                .category(entity.getCategory())
                .build();
    }

    private static List<LineItem> toLineItems(List<LineItemEntity> entities) {
        return entities.stream()
                .map(e -> LineItem.builder()
                        .entityId(e.getEntityId())
                        .period(e.getPeriod())
                        .line(e.getLineCode())
                        .column(e.getColumnCode())
                        .value(e.getItemValue())
                        .build())
                .toList();
    }

    // Fallback methods (circuit breaker)

    private List<Integer> periodsFallback(Exception e) {
        throw unavailable("periods", e);
    }

    private List<EntitySummary> entitiesFallback(Exception e) {
        throw unavailable("entity list", e);
    }

    private List<LineItem> findByPeriodFallback(int period, Exception e) {
        throw unavailable("period " + period, e);
    }

    private List<LineItem> findByEntityFallback(String entityId, Collection<Integer> periods, Exception e) {
        throw unavailable("entity " + entityId, e);
    }

    private List<LineItem> findByEntitiesFallback(Collection<String> entityIds, Collection<Integer> periods, Exception e) {
        throw unavailable(entityIds.size() + " entities", e);
    }

    private Map<String, EntityProfile> profilesFallback(Exception e) {
        throw unavailable("entity profiles", e);
    }

    private Optional<EntityProfile> profileFallback(String entityId, Exception e) {
        throw unavailable("profile of " + entityId, e);
    }

    private static StorageUnavailableException unavailable(String what, Exception e) {
        log.warn("Line-item store read failed ({}): {}", what, e.getMessage());
        return new StorageUnavailableException("Line-item store unavailable reading " + what, e);
    }
}
