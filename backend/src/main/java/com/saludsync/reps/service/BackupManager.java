package com.saludsync.reps.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.saludsync.reps.dto.RegistrySnapshot;
import com.saludsync.reps.dto.RegistrySnapshot.CapacityRecord;
import com.saludsync.reps.dto.RegistrySnapshot.FacilityRecord;
import com.saludsync.reps.dto.RegistrySnapshot.ServiceRecord;
import com.saludsync.reps.exception.BackupCaptureException;
import com.saludsync.reps.exception.BackupRestoreException;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.model.RegistryBackup;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.HealthOrganizationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.repository.RegistryBackupRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshots an organization's facilities, services and installed capacity before a sync and puts them back when the sync fails.
 * Both operations run in their own transaction so a restore survives the rollback of the sync itself.
 */
@Service
public class BackupManager {

    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);

    @Value("${reps.sync.keep-backups:false}")
    private boolean keepBackups;

    private final RegistryBackupRepository backupRepository;
    private final HealthOrganizationRepository organizationRepository;
    private final FacilityLocationRepository facilityRepository;
    private final EnabledServiceRepository serviceRepository;
    private final InstalledCapacityRepository capacityRepository;
    private final ObjectMapper objectMapper;

    public BackupManager(RegistryBackupRepository backupRepository,
                         HealthOrganizationRepository organizationRepository,
                         FacilityLocationRepository facilityRepository,
                         EnabledServiceRepository serviceRepository,
                         InstalledCapacityRepository capacityRepository,
                         ObjectMapper objectMapper) {
        this.backupRepository = backupRepository;
        this.organizationRepository = organizationRepository;
        this.facilityRepository = facilityRepository;
        this.serviceRepository = serviceRepository;
        this.capacityRepository = capacityRepository;
        this.objectMapper = objectMapper;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String capture(Long organizationId) {
        try {
            List<FacilityRecord> facilities = facilityRepository.findByOrganizationId(organizationId).stream()
                    .map(FacilityRecord::of)
                    .toList();
            List<ServiceRecord> services = serviceRepository.findAllByOrganization(organizationId).stream()
                    .map(ServiceRecord::of)
                    .toList();
            List<CapacityRecord> capacities = capacityRepository.findAllByOrganization(organizationId).stream()
                    .map(CapacityRecord::of)
                    .toList();
            Instant now = Instant.now();
            RegistrySnapshot snapshot = new RegistrySnapshot(organizationId, now, facilities, services, capacities);

            RegistryBackup backup = new RegistryBackup();
            backup.setId(UUID.randomUUID().toString());
            backup.setOrganizationId(organizationId);
            backup.setCapturedAt(now);
            backup.setFacilityCount(facilities.size());
            backup.setServiceCount(services.size());
            backup.setCapacityCount(capacities.size());
            backup.setPayload(objectMapper.writeValueAsString(snapshot));
            backupRepository.save(backup);
            log.info("[REPS_SYNC][BACKUP] captured {} for org={} ({} facilities, {} services, {} capacities)",
                    backup.getId(), organizationId, facilities.size(), services.size(), capacities.size());
            return backup.getId();
        } catch (JsonProcessingException e) {
            throw new BackupCaptureException("Could not serialize registry snapshot for organization " + organizationId, e);
        } catch (RuntimeException e) {
            throw new BackupCaptureException("Could not capture registry snapshot for organization " + organizationId
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Replaces everything the organization currently has with the captured snapshot. All-or-nothing:
     * any failure rolls this transaction back and surfaces as {@link BackupRestoreException}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, rollbackFor = Exception.class)
    public void restore(String backupId) {
        RegistryBackup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> new BackupRestoreException("Backup " + backupId + " does not exist"));
        if (backup.isConsumed()) {
            throw new BackupRestoreException("Backup " + backupId + " was already restored at " + backup.getRestoredAt());
        }
        RegistrySnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(backup.getPayload(), RegistrySnapshot.class);
        } catch (JsonProcessingException e) {
            throw new BackupRestoreException("Backup " + backupId + " payload is unreadable", e);
        }
        Long orgId = snapshot.organizationId();
        HealthOrganization organization = organizationRepository.findById(orgId)
                .orElseThrow(() -> new BackupRestoreException("Organization " + orgId + " of backup " + backupId + " no longer exists"));

        int removedCapacities = capacityRepository.deleteAllByOrganization(orgId);
        int removedServices = serviceRepository.deleteAllByOrganization(orgId);
        int removedFacilities = facilityRepository.deleteAllByOrganization(orgId);

        Map<String, FacilityLocation> byCode = new HashMap<>();
        for (FacilityRecord record : snapshot.facilities()) {
            FacilityLocation f = record.toEntity();
            f.setOrganization(organization);
            byCode.put(f.getRegistryCode(), facilityRepository.save(f));
        }
        List<EnabledService> services = new ArrayList<>();
        for (ServiceRecord record : snapshot.services()) {
            FacilityLocation parent = byCode.get(record.facilityRegistryCode());
            if (parent == null) {
                throw new BackupRestoreException("Backup " + backupId + " references unknown facility " + record.facilityRegistryCode());
            }
            services.add(record.toEntity(parent));
        }
        serviceRepository.saveAll(services);
        serviceRepository.flush();
        List<InstalledCapacity> capacities = new ArrayList<>();
        for (CapacityRecord record : snapshot.capacities()) {
            FacilityLocation parent = byCode.get(record.facilityRegistryCode());
            if (parent == null) {
                throw new BackupRestoreException("Backup " + backupId + " references unknown facility " + record.facilityRegistryCode());
            }
            capacities.add(record.toEntity(parent));
        }
        capacityRepository.saveAll(capacities);
        capacityRepository.flush();

        backup.setConsumed(true);
        backup.setRestoredAt(Instant.now());
        backupRepository.save(backup);
        log.info("[REPS_SYNC][BACKUP] restored {} for org={}: removed {}/{}/{} and recreated {}/{}/{} facilities/services/capacities",
                backupId, orgId, removedFacilities, removedServices, removedCapacities,
                snapshot.facilities().size(), services.size(), capacities.size());
    }

    /** Drops the snapshot after a successful run unless backups are retained for audit. */
    @Transactional
    public void discard(String backupId) {
        if (backupId == null || keepBackups) return;
        backupRepository.deleteById(backupId);
        log.debug("[REPS_SYNC][BACKUP] discarded {}", backupId);
    }
}
