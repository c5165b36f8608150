package com.saludsync.reps.dto;

import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.model.SyncStatus;

import java.time.Instant;
import java.util.List;

public record SyncRunResult(Long runId,
                            Long organizationId,
                            SyncStatus status,
                            int totalRows,
                            int validRows,
                            int invalidRows,
                            int importedCount,
                            int updatedCount,
                            int skippedCount,
                            int errorCount,
                            List<String> errors,
                            List<String> warnings,
                            boolean backupCreated,
                            String backupId,
                            List<FileProcessed> filesProcessed,
                            Instant startTime,
                            Instant endTime) {

    public record FileProcessed(String file, RowKind kind, FileStats stats) {}

    public record FileStats(int totalRows,
                            int validRows,
                            int invalidRows,
                            int importedCount,
                            int updatedCount,
                            int skippedCount,
                            int errorCount) {}
}
