package com.saludsync.reps.dto;

import java.util.List;

public record CleanupReport(Long organizationId,
                            boolean dryRun,
                            int examined,
                            List<CodeChange> changes,
                            List<String> skipped) {

    public record CodeChange(Long facilityId, String from, String to) {}
}
