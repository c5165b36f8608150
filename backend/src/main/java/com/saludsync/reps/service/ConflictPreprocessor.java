package com.saludsync.reps.service;

import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hard-deletes soft-deleted rows whose natural key is about to be written again. The unique keys on
 * facility_location and enabled_service ignore deleted_at, so a stale tombstone would block the insert.
 * Tombstones outside the incoming key set are never touched.
 */
@Service
public class ConflictPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(ConflictPreprocessor.class);

    private final FacilityLocationRepository facilityRepository;
    private final EnabledServiceRepository serviceRepository;
    private final InstalledCapacityRepository capacityRepository;

    public ConflictPreprocessor(FacilityLocationRepository facilityRepository,
                                EnabledServiceRepository serviceRepository,
                                InstalledCapacityRepository capacityRepository) {
        this.facilityRepository = facilityRepository;
        this.serviceRepository = serviceRepository;
        this.capacityRepository = capacityRepository;
    }

    @Transactional
    public int purgeFacilityTombstones(Long organizationId, Collection<String> incomingKeys) {
        if (incomingKeys == null || incomingKeys.isEmpty()) return 0;
        List<String> colliding = facilityRepository.findTombstonedCodes(organizationId, new HashSet<>(incomingKeys));
        if (colliding.isEmpty()) return 0;
        int capacities = capacityRepository.deleteUnderTombstonedFacilities(organizationId, colliding);
        int services = serviceRepository.deleteUnderTombstonedFacilities(organizationId, colliding);
        int facilities = facilityRepository.deleteTombstonedByCodes(organizationId, colliding);
        log.info("[CONFLICT_PREPROCESS] org={} purged {} tombstoned facilities ({} attached services, {} capacities): {}",
                organizationId, facilities, services, capacities, colliding);
        return facilities;
    }

    /**
     * @param incomingByFacilityKey service codes of the incoming file grouped by facility registry code
     */
    @Transactional
    public int purgeServiceTombstones(Long organizationId, Map<String, Set<String>> incomingByFacilityKey) {
        if (incomingByFacilityKey == null || incomingByFacilityKey.isEmpty()) return 0;
        Set<String> allCodes = new HashSet<>();
        incomingByFacilityKey.values().forEach(allCodes::addAll);
        if (allCodes.isEmpty()) return 0;

        List<EnabledService> candidates = serviceRepository.findTombstonedCandidates(
                organizationId, incomingByFacilityKey.keySet(), allCodes);
        // the query is a cross product of both code sets; keep exact (facility, service) pairs only
        List<Long> ids = candidates.stream()
                .filter(s -> incomingByFacilityKey
                        .getOrDefault(s.getFacility().getRegistryCode(), Set.of())
                        .contains(s.getServiceCode()))
                .map(EnabledService::getId)
                .toList();
        if (ids.isEmpty()) return 0;
        int purged = serviceRepository.deleteByIds(ids);
        log.info("[CONFLICT_PREPROCESS] org={} purged {} tombstoned services", organizationId, purged);
        return purged;
    }
}
