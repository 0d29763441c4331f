package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.BuildGenerationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BuildGenerationRepository extends JpaRepository<BuildGenerationEntity, Long> {

    List<BuildGenerationEntity> findTop10ByOrderByGenerationIdDesc();
}
