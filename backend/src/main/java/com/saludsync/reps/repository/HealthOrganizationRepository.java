package com.saludsync.reps.repository;

import com.saludsync.reps.model.HealthOrganization;
import org.springframework.data.jpa.repository.JpaRepository;

public interface HealthOrganizationRepository extends JpaRepository<HealthOrganization, Long> {
}
