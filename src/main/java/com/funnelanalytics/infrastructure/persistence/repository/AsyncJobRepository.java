package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AsyncJobRepository extends JpaRepository<AsyncJobEntity, UUID> {

    List<AsyncJobEntity> findByStatusOrderByCreatedAtAsc(AsyncJobEntity.JobStatus status, Pageable pageable);
}
