package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;

/** Audit row of one capacity import. Errors, warnings and per-group statistics are stored as JSON. */
@Entity
@Table(name = "capacity_import_log", indexes = {
        @Index(name = "idx_capacity_log_org_started", columnList = "organization_id, started_at")
})
public class CapacityImportLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "file_name", length = 255)
    private String fileName;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_format", length = 8)
    private String fileFormat;

    @Column(length = 32)
    private String status = CapacityImportStatus.STARTED.name();

    @Column(name = "validation_only")
    private boolean validationOnly;

    @Column(name = "total_rows")
    private Integer totalRows = 0;

    @Column(name = "imported_count")
    private Integer importedCount = 0;

    @Column(name = "updated_count")
    private Integer updatedCount = 0;

    @Column(name = "error_count")
    private Integer errorCount = 0;

    @Lob
    private String errors;

    @Lob
    private String warnings;

    @Lob
    private String statistics;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getOrganizationId() { return organizationId; }
    public void setOrganizationId(Long organizationId) { this.organizationId = organizationId; }
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }
    public String getFileFormat() { return fileFormat; }
    public void setFileFormat(String fileFormat) { this.fileFormat = fileFormat; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public boolean isValidationOnly() { return validationOnly; }
    public void setValidationOnly(boolean validationOnly) { this.validationOnly = validationOnly; }
    public Integer getTotalRows() { return totalRows; }
    public void setTotalRows(Integer totalRows) { this.totalRows = totalRows; }
    public Integer getImportedCount() { return importedCount; }
    public void setImportedCount(Integer importedCount) { this.importedCount = importedCount; }
    public Integer getUpdatedCount() { return updatedCount; }
    public void setUpdatedCount(Integer updatedCount) { this.updatedCount = updatedCount; }
    public Integer getErrorCount() { return errorCount; }
    public void setErrorCount(Integer errorCount) { this.errorCount = errorCount; }
    public String getErrors() { return errors; }
    public void setErrors(String errors) { this.errors = errors; }
    public String getWarnings() { return warnings; }
    public void setWarnings(String warnings) { this.warnings = warnings; }
    public String getStatistics() { return statistics; }
    public void setStatistics(String statistics) { this.statistics = statistics; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public Long getDurationSeconds() { return durationSeconds; }
    public void setDurationSeconds(Long durationSeconds) { this.durationSeconds = durationSeconds; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
}
