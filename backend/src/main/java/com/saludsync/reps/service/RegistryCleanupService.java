package com.saludsync.reps.service;

import com.saludsync.reps.dto.CleanupDiagnosis;
import com.saludsync.reps.dto.CleanupReport;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.util.RegistryCodeSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Finds and repairs facility registry codes damaged by older imports (UUID suffixes, stray whitespace,
 * illegal characters). Tombstoned facilities are included because their codes still occupy the unique key.
 */
@Service
public class RegistryCleanupService {

    private static final Logger log = LoggerFactory.getLogger(RegistryCleanupService.class);

    private final FacilityLocationRepository facilityRepository;

    public RegistryCleanupService(FacilityLocationRepository facilityRepository) {
        this.facilityRepository = facilityRepository;
    }

    @Transactional(readOnly = true)
    public CleanupDiagnosis diagnose(Long organizationId) {
        List<FacilityLocation> facilities = facilityRepository.findByOrganizationId(organizationId);
        List<String> uuid = new ArrayList<>();
        List<String> whitespace = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        Map<String, List<Long>> groups = new TreeMap<>();
        for (FacilityLocation f : facilities) {
            String code = f.getRegistryCode();
            if (RegistryCodeSanitizer.hasUuidSuffix(code)) uuid.add(code);
            if (RegistryCodeSanitizer.hasWhitespaceIssue(code)) whitespace.add(code);
            if (!RegistryCodeSanitizer.isValid(code)) invalid.add(code);
            groups.computeIfAbsent(RegistryCodeSanitizer.repair(code), k -> new ArrayList<>()).add(f.getId());
        }
        Map<String, List<Long>> duplicates = new TreeMap<>();
        groups.forEach((k, ids) -> { if (ids.size() > 1) duplicates.put(k, List.copyOf(ids)); });

        List<String> recommendations = new ArrayList<>();
        if (!uuid.isEmpty()) {
            recommendations.add("Ejecutar la limpieza para quitar el sufijo UUID de " + uuid.size() + " código(s)");
        }
        if (!whitespace.isEmpty()) {
            recommendations.add("Normalizar espacios en " + whitespace.size() + " código(s)");
        }
        if (!invalid.isEmpty()) {
            recommendations.add("Revisar " + invalid.size() + " código(s) con formato inválido, p. ej. '" + invalid.get(0)
                    + "': " + RegistryCodeSanitizer.formatIssue(invalid.get(0)));
        }
        if (!duplicates.isEmpty()) {
            recommendations.add("Resolver manualmente " + duplicates.size() + " grupo(s) de códigos que colisionan tras sanear");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("No se requieren acciones");
        }
        return new CleanupDiagnosis(organizationId, facilities.size(), uuid, whitespace, invalid, duplicates, recommendations);
    }

    /**
     * Rewrites every damaged code to its repaired form. A repair that would land on a code already held by
     * another facility, or that leaves nothing, is reported and skipped. With {@code dryRun} nothing is saved.
     */
    @Transactional
    public CleanupReport cleanup(Long organizationId, boolean dryRun) {
        List<FacilityLocation> facilities = facilityRepository.findByOrganizationId(organizationId);
        Set<String> taken = new HashSet<>();
        facilities.forEach(f -> taken.add(f.getRegistryCode()));

        List<CleanupReport.CodeChange> changes = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (FacilityLocation f : facilities) {
            String from = f.getRegistryCode();
            String to = RegistryCodeSanitizer.repair(from);
            if (to.equals(from)) continue;
            if (to.isEmpty()) {
                skipped.add(from + ": no queda un código utilizable");
                continue;
            }
            if (taken.contains(to)) {
                skipped.add(from + ": '" + to + "' ya está en uso");
                continue;
            }
            taken.remove(from);
            taken.add(to);
            changes.add(new CleanupReport.CodeChange(f.getId(), from, to));
            if (!dryRun) {
                f.setRegistryCode(to);
                facilityRepository.save(f);
            }
        }
        log.info("[REPS_CLEANUP] org={} dryRun={} examined={} repaired={} skipped={}",
                organizationId, dryRun, facilities.size(), changes.size(), skipped.size());
        return new CleanupReport(organizationId, dryRun, facilities.size(), changes, skipped);
    }
}
