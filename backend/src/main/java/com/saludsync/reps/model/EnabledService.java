package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "enabled_service", uniqueConstraints = {
        @UniqueConstraint(name = "uk_service_facility_code", columnNames = {"facility_id", "service_code"})
}, indexes = {
        @Index(name = "idx_service_facility_deleted", columnList = "facility_id, deleted_at")
})
public class EnabledService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "facility_id", nullable = false, foreignKey = @ForeignKey(name = "fk_service_facility"))
    private FacilityLocation facility;

    @Column(name = "service_code", nullable = false, length = 32)
    private String serviceCode;

    @Column(name = "service_name", nullable = false, length = 255)
    private String serviceName;

    @Column(name = "service_group_code", length = 32)
    private String serviceGroupCode;

    @Column(name = "service_group_name", length = 255)
    private String serviceGroupName;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private ComplexityLevel complexity = ComplexityLevel.LOW;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private YesNo ambulatory = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private YesNo hospital = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(name = "mobile_unit", length = 8)
    private YesNo mobileUnit = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private YesNo domiciliary = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(name = "other_extramural", length = 8)
    private YesNo otherExtramural = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private YesNo intramural = YesNo.UNKNOWN;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private YesNo telemedicine = YesNo.UNKNOWN;

    @Column(name = "distinctive_code", length = 64)
    private String distinctiveCode;

    @Column(name = "habilitation_date")
    private LocalDate habilitationDate;

    @Column(name = "closing_date")
    private LocalDate closingDate;

    @Column(name = "installed_capacity")
    private Integer installedCapacity = 0;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private ServiceStatus status = ServiceStatus.ACTIVE;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    @Column(name = "sync_status", length = 32)
    private String syncStatus;

    public EnabledService() {}

    @PrePersist
    private void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = createdAt;
    }

    @PreUpdate
    private void preUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() { return deletedAt == null; }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public FacilityLocation getFacility() { return facility; }
    public void setFacility(FacilityLocation facility) { this.facility = facility; }
    public String getServiceCode() { return serviceCode; }
    public void setServiceCode(String serviceCode) { this.serviceCode = serviceCode; }
    public String getServiceName() { return serviceName; }
    public void setServiceName(String serviceName) { this.serviceName = serviceName; }
    public String getServiceGroupCode() { return serviceGroupCode; }
    public void setServiceGroupCode(String serviceGroupCode) { this.serviceGroupCode = serviceGroupCode; }
    public String getServiceGroupName() { return serviceGroupName; }
    public void setServiceGroupName(String serviceGroupName) { this.serviceGroupName = serviceGroupName; }
    public ComplexityLevel getComplexity() { return complexity; }
    public void setComplexity(ComplexityLevel complexity) { this.complexity = complexity; }
    public YesNo getAmbulatory() { return ambulatory; }
    public void setAmbulatory(YesNo ambulatory) { this.ambulatory = ambulatory; }
    public YesNo getHospital() { return hospital; }
    public void setHospital(YesNo hospital) { this.hospital = hospital; }
    public YesNo getMobileUnit() { return mobileUnit; }
    public void setMobileUnit(YesNo mobileUnit) { this.mobileUnit = mobileUnit; }
    public YesNo getDomiciliary() { return domiciliary; }
    public void setDomiciliary(YesNo domiciliary) { this.domiciliary = domiciliary; }
    public YesNo getOtherExtramural() { return otherExtramural; }
    public void setOtherExtramural(YesNo otherExtramural) { this.otherExtramural = otherExtramural; }
    public YesNo getIntramural() { return intramural; }
    public void setIntramural(YesNo intramural) { this.intramural = intramural; }
    public YesNo getTelemedicine() { return telemedicine; }
    public void setTelemedicine(YesNo telemedicine) { this.telemedicine = telemedicine; }
    public String getDistinctiveCode() { return distinctiveCode; }
    public void setDistinctiveCode(String distinctiveCode) { this.distinctiveCode = distinctiveCode; }
    public LocalDate getHabilitationDate() { return habilitationDate; }
    public void setHabilitationDate(LocalDate habilitationDate) { this.habilitationDate = habilitationDate; }
    public LocalDate getClosingDate() { return closingDate; }
    public void setClosingDate(LocalDate closingDate) { this.closingDate = closingDate; }
    public Integer getInstalledCapacity() { return installedCapacity; }
    public void setInstalledCapacity(Integer installedCapacity) { this.installedCapacity = installedCapacity; }
    public ServiceStatus getStatus() { return status; }
    public void setStatus(ServiceStatus status) { this.status = status; }
    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getUpdatedBy() { return updatedBy; }
    public void setUpdatedBy(String updatedBy) { this.updatedBy = updatedBy; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getLastSyncAt() { return lastSyncAt; }
    public void setLastSyncAt(Instant lastSyncAt) { this.lastSyncAt = lastSyncAt; }
    public String getSyncStatus() { return syncStatus; }
    public void setSyncStatus(String syncStatus) { this.syncStatus = syncStatus; }
}
