package com.saludsync.reps.dto;

import java.time.Instant;

public record CapacityImportLogDTO(Long id,
                                   String fileName,
                                   String fileFormat,
                                   String status,
                                   boolean validationOnly,
                                   Integer totalRows,
                                   Integer importedCount,
                                   Integer updatedCount,
                                   Integer errorCount,
                                   String createdBy,
                                   Instant startedAt,
                                   Instant finishedAt) {
}
