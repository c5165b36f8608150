package com.saludsync.reps.dto;

import java.util.List;
import java.util.Map;

/**
 * Registry-code health of one organization. Each list holds the offending codes as stored.
 */
public record CleanupDiagnosis(Long organizationId,
                               int totalFacilities,
                               List<String> uuidCorrupted,
                               List<String> whitespaceIssues,
                               List<String> invalidFormat,
                               Map<String, List<Long>> duplicateGroups,
                               List<String> recommendations) {

    public boolean isClean() {
        return uuidCorrupted.isEmpty() && whitespaceIssues.isEmpty() && invalidFormat.isEmpty() && duplicateGroups.isEmpty();
    }
}
