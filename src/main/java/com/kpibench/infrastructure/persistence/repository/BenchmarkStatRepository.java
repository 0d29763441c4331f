package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.BenchmarkStatEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BenchmarkStatRepository extends JpaRepository<BenchmarkStatEntity, Long> {

    List<BenchmarkStatEntity> findByGenerationId(Long generationId);

    long countByGenerationId(Long generationId);

    @Modifying
    @Query("DELETE FROM BenchmarkStatEntity b WHERE b.generationId = :generationId")
    int deleteByGeneration(@Param("generationId") Long generationId);

    @Modifying
    @Query("DELETE FROM BenchmarkStatEntity b WHERE b.generationId < :generationId")
    int deleteOlderThan(@Param("generationId") Long generationId);
}
