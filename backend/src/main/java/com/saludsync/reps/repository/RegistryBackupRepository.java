package com.saludsync.reps.repository;

import com.saludsync.reps.model.RegistryBackup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RegistryBackupRepository extends JpaRepository<RegistryBackup, String> {
    List<RegistryBackup> findByOrganizationIdOrderByCapturedAtDesc(Long organizationId);
}
