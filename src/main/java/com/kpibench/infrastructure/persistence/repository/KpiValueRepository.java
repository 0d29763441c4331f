package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.KpiValueEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface KpiValueRepository extends JpaRepository<KpiValueEntity, Long> {

    List<KpiValueEntity> findByGenerationId(Long generationId);

    long countByGenerationId(Long generationId);

    @Modifying
    @Query("DELETE FROM KpiValueEntity k WHERE k.generationId = :generationId")
    int deleteByGeneration(@Param("generationId") Long generationId);

    @Modifying
    @Query("DELETE FROM KpiValueEntity k WHERE k.generationId < :generationId")
    int deleteOlderThan(@Param("generationId") Long generationId);
}
