package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "sync_run", indexes = {
        @Index(name = "idx_syncrun_org_started", columnList = "organization_id, started_at")
})
public class SyncRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(length = 100)
    private String createdBy; // acting user for the run

    @Column(name = "facilities_file", length = 255)
    private String facilitiesFile;

    @Column(name = "services_file", length = 255)
    private String servicesFile;

    @Column(name = "create_backup")
    private boolean createBackup;

    @Column(name = "force_recreate")
    private boolean forceRecreate;

    @Column(name = "backup_id", length = 36)
    private String backupId;

    @Column(name = "rows_total")
    private Integer rowsTotal = 0;

    @Column(name = "rows_valid")
    private Integer rowsValid = 0;

    @Column(name = "rows_invalid")
    private Integer rowsInvalid = 0;

    @Column(name = "imported_count")
    private Integer importedCount = 0;

    @Column(name = "updated_count")
    private Integer updatedCount = 0;

    @Column(name = "skipped_count")
    private Integer skippedCount = 0;

    @Column(name = "error_count")
    private Integer errorCount = 0;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = SyncStatus.PENDING.name();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getOrganizationId() { return organizationId; }
    public void setOrganizationId(Long organizationId) { this.organizationId = organizationId; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public String getFacilitiesFile() { return facilitiesFile; }
    public void setFacilitiesFile(String facilitiesFile) { this.facilitiesFile = facilitiesFile; }
    public String getServicesFile() { return servicesFile; }
    public void setServicesFile(String servicesFile) { this.servicesFile = servicesFile; }
    public boolean isCreateBackup() { return createBackup; }
    public void setCreateBackup(boolean createBackup) { this.createBackup = createBackup; }
    public boolean isForceRecreate() { return forceRecreate; }
    public void setForceRecreate(boolean forceRecreate) { this.forceRecreate = forceRecreate; }
    public String getBackupId() { return backupId; }
    public void setBackupId(String backupId) { this.backupId = backupId; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsValid() { return rowsValid; }
    public void setRowsValid(Integer rowsValid) { this.rowsValid = rowsValid; }
    public Integer getRowsInvalid() { return rowsInvalid; }
    public void setRowsInvalid(Integer rowsInvalid) { this.rowsInvalid = rowsInvalid; }
    public Integer getImportedCount() { return importedCount; }
    public void setImportedCount(Integer importedCount) { this.importedCount = importedCount; }
    public Integer getUpdatedCount() { return updatedCount; }
    public void setUpdatedCount(Integer updatedCount) { this.updatedCount = updatedCount; }
    public Integer getSkippedCount() { return skippedCount; }
    public void setSkippedCount(Integer skippedCount) { this.skippedCount = skippedCount; }
    public Integer getErrorCount() { return errorCount; }
    public void setErrorCount(Integer errorCount) { this.errorCount = errorCount; }
    public String getFailureReason() { return failureReason; }
    public void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
