package com.saludsync.reps.repository;

import com.saludsync.reps.model.SyncRunError;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SyncRunErrorRepository extends JpaRepository<SyncRunError, Long> {
    List<SyncRunError> findBySyncRunIdOrderByIdAsc(Long syncRunId);
}
