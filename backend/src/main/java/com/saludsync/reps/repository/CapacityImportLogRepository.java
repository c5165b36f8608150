package com.saludsync.reps.repository;

import com.saludsync.reps.model.CapacityImportLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CapacityImportLogRepository extends JpaRepository<CapacityImportLog, Long> {
    List<CapacityImportLog> findByOrganizationIdOrderByStartedAtDesc(Long organizationId, Pageable pageable);
}
