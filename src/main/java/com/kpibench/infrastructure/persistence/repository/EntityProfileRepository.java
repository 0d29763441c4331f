package com.kpibench.infrastructure.persistence.repository;

import com.kpibench.infrastructure.persistence.entity.EntityProfileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EntityProfileRepository extends JpaRepository<EntityProfileEntity, String> {
}
