package com.saludsync.reps.service;

import com.saludsync.reps.model.ComplexityLevel;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.YesNo;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.FieldNormalizer;
import com.saludsync.reps.util.RepsColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class ServiceMapper {

    private static final Logger log = LoggerFactory.getLogger(ServiceMapper.class);

    private final ComplexityLevel unknownComplexityDefault;

    public ServiceMapper(@Value("${reps.sync.unknown-complexity-default:LOW}") ComplexityLevel unknownComplexityDefault) {
        this.unknownComplexityDefault = unknownComplexityDefault;
    }

    public EnabledService toService(RowValidationResult row, FacilityLocation facility, String actingUser, List<String> warnings) {
        EnabledService s = new EnabledService();
        s.setFacility(facility);
        s.setServiceCode(row.get(RepsColumns.SERVICE_CODE));
        s.setCreatedBy(actingUser);
        applyRow(s, row, actingUser, warnings);
        return s;
    }

    /** Copies every row-derived field onto {@code target}; parent, code and tombstone are untouched. */
    public void applyRow(EnabledService target, RowValidationResult row, String actingUser, List<String> warnings) {
        target.setServiceName(row.get(RepsColumns.SERVICE_NAME));
        target.setServiceGroupCode(blankToNull(row.get(RepsColumns.SERVICE_GROUP_CODE)));
        target.setServiceGroupName(blankToNull(row.get(RepsColumns.SERVICE_GROUP_NAME)));
        target.setComplexity(resolveComplexity(row, warnings));
        target.setAmbulatory(FieldNormalizer.yesNo(row.get(RepsColumns.AMBULATORY)));
        target.setHospital(FieldNormalizer.yesNo(row.get(RepsColumns.HOSPITAL)));
        target.setMobileUnit(FieldNormalizer.yesNo(row.get(RepsColumns.MOBILE_UNIT)));
        target.setDomiciliary(FieldNormalizer.yesNo(row.get(RepsColumns.DOMICILIARY)));
        target.setOtherExtramural(FieldNormalizer.yesNo(row.get(RepsColumns.OTHER_EXTRAMURAL)));
        target.setIntramural(FieldNormalizer.yesNo(row.get(RepsColumns.INTRAMURAL)));
        target.setTelemedicine(FieldNormalizer.yesNo(row.get(RepsColumns.TELEMEDICINE)));
        target.setDistinctiveCode(blankToNull(row.get(RepsColumns.DISTINCTIVE_NUMBER)));
        target.setHabilitationDate(FieldNormalizer.parseDate(row.get(RepsColumns.OPENING_DATE)).orElse(null));
        target.setClosingDate(FieldNormalizer.parseDate(row.get(RepsColumns.CLOSING_DATE)).orElse(null));
        target.setInstalledCapacity(FieldNormalizer.parseInt(row.get(RepsColumns.CAPACITY), 0));
        target.setStatus(FieldNormalizer.serviceStatus(row.get(RepsColumns.ENABLED)));
        target.setUpdatedBy(actingUser);
        target.setLastSyncAt(Instant.now());
        target.setSyncStatus(FacilityMapper.SYNC_STATUS_IMPORTED);
    }

    ComplexityLevel resolveComplexity(RowValidationResult row, List<String> warnings) {
        // the per-level SI/NO columns win over the free-text summary
        if (FieldNormalizer.yesNo(row.get(RepsColumns.HIGH_COMPLEXITY)) == YesNo.YES) return ComplexityLevel.HIGH;
        if (FieldNormalizer.yesNo(row.get(RepsColumns.MEDIUM_COMPLEXITY)) == YesNo.YES) return ComplexityLevel.MEDIUM;
        if (FieldNormalizer.yesNo(row.get(RepsColumns.LOW_COMPLEXITY)) == YesNo.YES) return ComplexityLevel.LOW;
        String text = row.get(RepsColumns.COMPLEXITIES);
        Optional<ComplexityLevel> parsed = FieldNormalizer.complexity(text);
        if (parsed.isPresent()) return parsed.get();
        String msg = "Fila " + row.getRowIndex() + ": complejidad '" + text + "' no reconocida, se asigna " + unknownComplexityDefault;
        log.debug("[REPS_SYNC] {}", msg);
        warnings.add(msg);
        return unknownComplexityDefault;
    }

    private static String blankToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
