package com.saludsync.reps.service;

import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HabilitationStatus;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.SiteType;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.DivipolaCatalog;
import com.saludsync.reps.util.FieldNormalizer;
import com.saludsync.reps.util.RegistryCodeSanitizer;
import com.saludsync.reps.util.RepsColumns;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class FacilityMapper {

    public static final String SYNC_STATUS_IMPORTED = "IMPORTED";

    public String naturalKey(RowValidationResult row) {
        return RegistryCodeSanitizer.naturalKey(row.get(RepsColumns.PROVIDER_CODE), row.get(RepsColumns.SITE_NUMBER));
    }

    /**
     * Builds a new, unsaved facility from a valid row.
     *
     * @param facilityExists whether the organization already has an active facility
     * @param mainExists     whether one of them is already flagged main
     */
    public FacilityLocation toFacility(RowValidationResult row,
                                       HealthOrganization organization,
                                       boolean facilityExists,
                                       boolean mainExists,
                                       String actingUser,
                                       List<String> warnings) {
        FacilityLocation f = new FacilityLocation();
        f.setOrganization(organization);
        f.setRegistryCode(naturalKey(row));
        f.setProviderCode(RegistryCodeSanitizer.sanitize(row.get(RepsColumns.PROVIDER_CODE)));
        f.setSiteNumber(row.get(RepsColumns.SITE_NUMBER));
        f.setCreatedBy(actingUser);
        applyRow(f, row, actingUser, warnings);
        f.setMainFacility(!facilityExists || (f.getSiteType() == SiteType.PRINCIPAL && !mainExists));
        return f;
    }

    /** Copies every row-derived field onto {@code target}. Identity, main flag and tombstone are left alone. */
    public void applyRow(FacilityLocation target, RowValidationResult row, String actingUser, List<String> warnings) {
        target.setName(row.get(RepsColumns.SITE_NAME));
        target.setSiteType(resolveSiteType(row));
        resolveDepartment(target, row, warnings);
        target.setMunicipalityName(row.get(RepsColumns.MUNICIPALITY));
        String muniCode = row.get(RepsColumns.MUNICIPALITY_CODE);
        target.setMunicipalityCode(muniCode.isEmpty() ? null : muniCode);
        target.setAddress(row.get(RepsColumns.ADDRESS));
        target.setPhone(truncate(FieldNormalizer.cleanPhone(row.get(RepsColumns.PHONE)), 64));
        target.setEmail(truncate(FieldNormalizer.cleanEmail(row.get(RepsColumns.EMAIL)), 255));
        target.setAdministrativeContact(truncate(row.get(RepsColumns.MANAGER), 255));
        HabilitationStatus habilitation = FieldNormalizer.habilitationStatus(row.get(RepsColumns.ENABLED));
        target.setHabilitationStatus(habilitation);
        target.setOperationalStatus(FieldNormalizer.operationalStatus(habilitation));
        target.setOpeningDate(FieldNormalizer.parseDate(row.get(RepsColumns.OPENING_DATE)).orElse(null));
        target.setClosingDate(FieldNormalizer.parseDate(row.get(RepsColumns.CLOSING_DATE)).orElse(null));
        target.setUpdatedBy(actingUser);
        target.setLastSyncAt(Instant.now());
        target.setSyncStatus(SYNC_STATUS_IMPORTED);
    }

    SiteType resolveSiteType(RowValidationResult row) {
        Optional<SiteType> explicit = FieldNormalizer.explicitSiteType(row.get(RepsColumns.SITE_TYPE));
        if (explicit.isPresent()) return explicit.get();
        String mainSite = row.get(RepsColumns.MAIN_SITE_NUMBER);
        if (!mainSite.isEmpty() && mainSite.equals(row.get(RepsColumns.SITE_NUMBER))) {
            return SiteType.PRINCIPAL;
        }
        return SiteType.SATELLITE;
    }

    private void resolveDepartment(FacilityLocation target, RowValidationResult row, List<String> warnings) {
        String dept = row.get(RepsColumns.DEPARTMENT);
        Optional<String> code;
        String name;
        if (!dept.isEmpty() && dept.chars().allMatch(Character::isDigit)) {
            String padded = dept.length() == 1 ? "0" + dept : dept;
            Optional<String> known = DivipolaCatalog.nameFor(padded);
            code = known.map(n -> padded);
            name = known.orElse(dept);
        } else {
            name = dept;
            code = DivipolaCatalog.codeFor(dept)
                    .or(() -> DivipolaCatalog.departmentOfMunicipality(row.get(RepsColumns.MUNICIPALITY_CODE)));
        }
        if (code.isEmpty()) {
            warnings.add("Fila " + row.getRowIndex() + ": departamento '" + dept + "' no encontrado en DIVIPOLA");
        }
        target.setDepartmentCode(code.orElse(null));
        target.setDepartmentName(name);
    }

    // free-text contact columns are clipped instead of failing the row
    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return null;
        return s.length() > max ? s.substring(0, max) : s;
    }
}
