package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.util.FieldNormalizer;
import com.saludsync.reps.util.RepsColumns;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class RowValidator {

    public static class RowValidationResult {
        private final int rowIndex;
        private final boolean valid;
        private final Map<String, String> data;
        private final List<String> errors;

        public RowValidationResult(int rowIndex, boolean valid, Map<String, String> data, List<String> errors) {
            this.rowIndex = rowIndex;
            this.valid = valid;
            this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
            this.errors = List.copyOf(errors);
        }

        public int getRowIndex() { return rowIndex; }
        public boolean isValid() { return valid; }
        /** Normalized values keyed by canonical column name. */
        public Map<String, String> getData() { return data; }
        /** Canonical names of every missing required field. */
        public List<String> getErrors() { return errors; }

        public String get(String canonical) {
            return data.getOrDefault(canonical, "");
        }
    }

    public static List<String> requiredFields(RowKind kind) {
        return switch (kind) {
            case SERVICES -> RepsColumns.SERVICE_REQUIRED;
            case CAPACITY -> RepsColumns.CAPACITY_REQUIRED;
            default -> RepsColumns.FACILITY_REQUIRED;
        };
    }

    /**
     * Normalizes every known column of the row and checks the required ones. Never throws:
     * a row with missing fields comes back invalid with all of them listed.
     */
    public RowValidationResult validate(RawRow row, RowKind kind) {
        Map<String, String> data = normalize(row);
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields(kind)) {
            if (data.getOrDefault(field, "").isEmpty()) missing.add(field);
        }
        return new RowValidationResult(row.getRowIndex(), missing.isEmpty(), data, missing);
    }

    static Map<String, String> normalize(RawRow row) {
        Map<String, String> data = new LinkedHashMap<>();
        for (String canonical : RepsColumns.ALIASES.keySet()) {
            String raw = row.get(canonical);
            if (raw == null) continue;
            String value = FieldNormalizer.repairEncoding(raw);
            if (RepsColumns.SITE_NUMBER.equals(canonical) || RepsColumns.MAIN_SITE_NUMBER.equals(canonical)) {
                value = FieldNormalizer.siteNumber(value);
            }
            data.put(canonical, value);
        }
        return data;
    }
}
