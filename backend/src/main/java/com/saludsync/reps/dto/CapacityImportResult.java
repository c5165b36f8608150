package com.saludsync.reps.dto;

import com.saludsync.reps.model.CapacityImportStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CapacityImportResult(Long importLogId,
                                   Long organizationId,
                                   String fileName,
                                   CapacityImportStatus status,
                                   boolean validationOnly,
                                   int totalRows,
                                   int successfulRows,
                                   int failedRows,
                                   int importedCount,
                                   int updatedCount,
                                   List<String> errors,
                                   List<String> warnings,
                                   Map<String, Integer> byGroup,
                                   Instant startTime,
                                   Instant endTime) {
}
