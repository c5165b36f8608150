package com.saludsync.reps.dto;

import java.time.Instant;

public class SyncRunSummaryDTO {
    private Long id;
    private Long organizationId;
    private String status;
    private Integer rowsTotal;
    private Integer rowsValid;
    private Integer rowsInvalid;
    private Integer importedCount;
    private Integer updatedCount;
    private Integer skippedCount;
    private Integer errorCount;
    private String facilitiesFile;
    private String servicesFile;
    private String createdBy;
    private Instant startedAt;
    private Instant finishedAt;

    public SyncRunSummaryDTO() {}

    public SyncRunSummaryDTO(Long id, Long organizationId, String status, Integer rowsTotal, Integer rowsValid,
                             Integer rowsInvalid, Integer importedCount, Integer updatedCount, Integer skippedCount,
                             Integer errorCount, String facilitiesFile, String servicesFile, String createdBy,
                             Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.organizationId = organizationId;
        this.status = status;
        this.rowsTotal = rowsTotal;
        this.rowsValid = rowsValid;
        this.rowsInvalid = rowsInvalid;
        this.importedCount = importedCount;
        this.updatedCount = updatedCount;
        this.skippedCount = skippedCount;
        this.errorCount = errorCount;
        this.facilitiesFile = facilitiesFile;
        this.servicesFile = servicesFile;
        this.createdBy = createdBy;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getOrganizationId() { return organizationId; }
    public void setOrganizationId(Long organizationId) { this.organizationId = organizationId; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
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
    public String getFacilitiesFile() { return facilitiesFile; }
    public void setFacilitiesFile(String facilitiesFile) { this.facilitiesFile = facilitiesFile; }
    public String getServicesFile() { return servicesFile; }
    public void setServicesFile(String servicesFile) { this.servicesFile = servicesFile; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
