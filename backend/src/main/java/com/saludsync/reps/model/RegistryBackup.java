package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Serialized snapshot of one organization's facilities, services and installed capacity, taken before a sync mutates them.
 * The payload is a JSON {@code RegistrySnapshot}; the row itself is never updated except to mark it consumed.
 */
@Entity
@Table(name = "registry_backup", indexes = {
        @Index(name = "idx_backup_org_captured", columnList = "organization_id, captured_at")
})
public class RegistryBackup {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @Column(name = "facility_count")
    private Integer facilityCount = 0;

    @Column(name = "service_count")
    private Integer serviceCount = 0;

    @Column(name = "capacity_count")
    private Integer capacityCount = 0;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Column(nullable = false)
    private boolean consumed;

    @Column(name = "restored_at")
    private Instant restoredAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public Long getOrganizationId() { return organizationId; }
    public void setOrganizationId(Long organizationId) { this.organizationId = organizationId; }
    public Instant getCapturedAt() { return capturedAt; }
    public void setCapturedAt(Instant capturedAt) { this.capturedAt = capturedAt; }
    public Integer getFacilityCount() { return facilityCount; }
    public void setFacilityCount(Integer facilityCount) { this.facilityCount = facilityCount; }
    public Integer getServiceCount() { return serviceCount; }
    public void setServiceCount(Integer serviceCount) { this.serviceCount = serviceCount; }
    public Integer getCapacityCount() { return capacityCount; }
    public void setCapacityCount(Integer capacityCount) { this.capacityCount = capacityCount; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public boolean isConsumed() { return consumed; }
    public void setConsumed(boolean consumed) { this.consumed = consumed; }
    public Instant getRestoredAt() { return restoredAt; }
    public void setRestoredAt(Instant restoredAt) { this.restoredAt = restoredAt; }
}
