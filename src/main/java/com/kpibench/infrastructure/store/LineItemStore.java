package com.kpibench.infrastructure.store;

import com.kpibench.domain.model.EntityProfile;
import com.kpibench.domain.model.EntitySummary;
import com.kpibench.domain.model.LineItem;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to raw line-items (partitioned by period) and entity profiles.
 *
 * Implementations throw {@link com.kpibench.domain.exception.StorageUnavailableException}
 * when the backing storage cannot be read.
 */
public interface LineItemStore {

    List<Integer> periods();

    /**
     * Every entity with at least one line-item, ordered by id.
     */
    List<EntitySummary> entities();

    List<LineItem> findByPeriod(int period);

    List<LineItem> findByEntity(String entityId, Collection<Integer> periods);

    List<LineItem> findByEntities(Collection<String> entityIds, Collection<Integer> periods);

    Map<String, EntityProfile> profiles();

    Optional<EntityProfile> profile(String entityId);

    /**
     * Cheap reachability probe; never throws.
     */
    boolean isReachable();
}
