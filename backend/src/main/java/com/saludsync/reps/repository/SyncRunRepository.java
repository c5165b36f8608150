package com.saludsync.reps.repository;

import com.saludsync.reps.model.SyncRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {
    Page<SyncRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
