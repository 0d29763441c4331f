package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.LineItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read access to the line-item store. Every query is bounded by period,
 * matching the store's period partitioning.
 */
@Repository
public interface LineItemRepository extends JpaRepository<LineItemEntity, Long> {

    @Query("SELECT DISTINCT l.period FROM LineItemEntity l ORDER BY l.period")
    List<Integer> findDistinctPeriods();

    /**
     * One row per entity: entityId, distinct period count, first period, latest period.
     */
    @Query("SELECT l.entityId, COUNT(DISTINCT l.period), MIN(l.period), MAX(l.period) " +
           "FROM LineItemEntity l GROUP BY l.entityId ORDER BY l.entityId")
    List<Object[]> summarizeEntities();

    List<LineItemEntity> findByPeriod(int period);

    List<LineItemEntity> findByEntityIdAndPeriodIn(String entityId, Collection<Integer> periods);

    @Query("SELECT l FROM LineItemEntity l WHERE l.period IN :periods AND l.entityId IN :entityIds")
    List<LineItemEntity> findByPeriodsAndEntities(
            @Param("periods") Collection<Integer> periods,
            @Param("entityIds") Collection<String> entityIds
    );
}
