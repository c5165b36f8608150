package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "facility_location", uniqueConstraints = {
        @UniqueConstraint(name = "uk_facility_org_registry_code", columnNames = {"organization_id", "registry_code"})
}, indexes = {
        @Index(name = "idx_facility_org_deleted", columnList = "organization_id, deleted_at"),
        @Index(name = "idx_facility_org_main", columnList = "organization_id, main_facility")
})
public class FacilityLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id", nullable = false, foreignKey = @ForeignKey(name = "fk_facility_org"))
    private HealthOrganization organization;

    @Column(name = "registry_code", nullable = false, length = 64)
    private String registryCode;

    @Column(name = "provider_code", length = 32)
    private String providerCode;

    @Column(name = "site_number", length = 16)
    private String siteNumber;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "site_type", length = 32, nullable = false)
    private SiteType siteType = SiteType.SATELLITE;

    @Column(name = "department_code", length = 8)
    private String departmentCode;

    @Column(name = "department_name", length = 100)
    private String departmentName;

    @Column(name = "municipality_code", length = 8)
    private String municipalityCode;

    @Column(name = "municipality_name", length = 100)
    private String municipalityName;

    @Column(length = 500)
    private String address;

    @Column(length = 64)
    private String phone;

    @Column(length = 255)
    private String email;

    @Column(name = "administrative_contact", length = 255)
    private String administrativeContact;

    @Enumerated(EnumType.STRING)
    @Column(name = "habilitation_status", length = 32)
    private HabilitationStatus habilitationStatus = HabilitationStatus.ENABLED;

    @Enumerated(EnumType.STRING)
    @Column(name = "operational_status", length = 32)
    private OperationalStatus operationalStatus = OperationalStatus.ACTIVE;

    @Column(name = "opening_date")
    private LocalDate openingDate;

    @Column(name = "closing_date")
    private LocalDate closingDate;

    @Column(name = "main_facility", nullable = false)
    private boolean mainFacility;

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

    public FacilityLocation() {}

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
    public HealthOrganization getOrganization() { return organization; }
    public void setOrganization(HealthOrganization organization) { this.organization = organization; }
    public String getRegistryCode() { return registryCode; }
    public void setRegistryCode(String registryCode) { this.registryCode = registryCode; }
    public String getProviderCode() { return providerCode; }
    public void setProviderCode(String providerCode) { this.providerCode = providerCode; }
    public String getSiteNumber() { return siteNumber; }
    public void setSiteNumber(String siteNumber) { this.siteNumber = siteNumber; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public SiteType getSiteType() { return siteType; }
    public void setSiteType(SiteType siteType) { this.siteType = siteType; }
    public String getDepartmentCode() { return departmentCode; }
    public void setDepartmentCode(String departmentCode) { this.departmentCode = departmentCode; }
    public String getDepartmentName() { return departmentName; }
    public void setDepartmentName(String departmentName) { this.departmentName = departmentName; }
    public String getMunicipalityCode() { return municipalityCode; }
    public void setMunicipalityCode(String municipalityCode) { this.municipalityCode = municipalityCode; }
    public String getMunicipalityName() { return municipalityName; }
    public void setMunicipalityName(String municipalityName) { this.municipalityName = municipalityName; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getAdministrativeContact() { return administrativeContact; }
    public void setAdministrativeContact(String administrativeContact) { this.administrativeContact = administrativeContact; }
    public HabilitationStatus getHabilitationStatus() { return habilitationStatus; }
    public void setHabilitationStatus(HabilitationStatus habilitationStatus) { this.habilitationStatus = habilitationStatus; }
    public OperationalStatus getOperationalStatus() { return operationalStatus; }
    public void setOperationalStatus(OperationalStatus operationalStatus) { this.operationalStatus = operationalStatus; }
    public LocalDate getOpeningDate() { return openingDate; }
    public void setOpeningDate(LocalDate openingDate) { this.openingDate = openingDate; }
    public LocalDate getClosingDate() { return closingDate; }
    public void setClosingDate(LocalDate closingDate) { this.closingDate = closingDate; }
    public boolean isMainFacility() { return mainFacility; }
    public void setMainFacility(boolean mainFacility) { this.mainFacility = mainFacility; }
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
