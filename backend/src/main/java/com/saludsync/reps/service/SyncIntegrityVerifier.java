package com.saludsync.reps.service;

import com.saludsync.reps.exception.IntegrityViolationException;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Service
public class SyncIntegrityVerifier {

    private final FacilityLocationRepository facilityRepository;
    private final EnabledServiceRepository serviceRepository;

    public SyncIntegrityVerifier(FacilityLocationRepository facilityRepository,
                                 EnabledServiceRepository serviceRepository) {
        this.facilityRepository = facilityRepository;
        this.serviceRepository = serviceRepository;
    }

    /**
     * Checks the services written by a run against their parents, plus the organization's main-facility rule.
     *
     * @throws IntegrityViolationException listing every violation found
     */
    @Transactional
    public void verify(Long organizationId, Collection<Long> touchedServiceIds) {
        List<String> violations = new ArrayList<>();
        if (touchedServiceIds != null && !touchedServiceIds.isEmpty()) {
            Set<Long> ids = new HashSet<>(touchedServiceIds);
            List<EnabledService> services = serviceRepository.findAllById(ids);
            if (services.size() != ids.size()) {
                violations.add((ids.size() - services.size()) + " service(s) written by this run are missing");
            }
            for (EnabledService s : services) {
                FacilityLocation parent = s.getFacility();
                if (parent == null) {
                    violations.add("Service " + s.getServiceCode() + " has no facility");
                    continue;
                }
                if (!parent.isActive()) {
                    violations.add("Service " + s.getServiceCode() + " references deleted facility " + parent.getRegistryCode());
                }
                Long parentOrg = parent.getOrganization() != null ? parent.getOrganization().getId() : null;
                if (!Objects.equals(parentOrg, organizationId)) {
                    violations.add("Service " + s.getServiceCode() + " references facility " + parent.getRegistryCode()
                            + " of organization " + parentOrg);
                }
            }
        }
        long mains = facilityRepository.countByOrganizationIdAndMainFacilityTrueAndDeletedAtIsNull(organizationId);
        if (mains > 1) {
            violations.add("Organization " + organizationId + " has " + mains + " main facilities");
        }
        if (!violations.isEmpty()) {
            throw new IntegrityViolationException(violations);
        }
    }
}
