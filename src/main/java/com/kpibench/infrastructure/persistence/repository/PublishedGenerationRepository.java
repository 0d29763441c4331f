package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.PublishedGenerationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PublishedGenerationRepository extends JpaRepository<PublishedGenerationEntity, String> {
}
