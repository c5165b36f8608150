package com.saludsync.reps.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * One installed-capacity line of a facility: a bed concept, a room type, an ambulance. Vehicles and
 * equipment are told apart by plate number, so the plate is part of the key and is "" when absent.
 */
@Entity
@Table(name = "installed_capacity", uniqueConstraints = {
        @UniqueConstraint(name = "uk_capacity_facility_concept_plate", columnNames = {"facility_id", "concept_code", "plate_number"})
}, indexes = {
        @Index(name = "idx_capacity_facility_group", columnList = "facility_id, capacity_group")
})
public class InstalledCapacity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "facility_id", nullable = false, foreignKey = @ForeignKey(name = "fk_capacity_facility"))
    private FacilityLocation facility;

    @Enumerated(EnumType.STRING)
    @Column(name = "capacity_group", length = 32, nullable = false)
    private CapacityGroup capacityGroup = CapacityGroup.OTHER;

    @Column(name = "concept_code", nullable = false, length = 32)
    private String conceptCode;

    @Column(name = "concept_name", nullable = false, length = 255)
    private String conceptName;

    @Column(nullable = false)
    private Integer quantity = 0;

    @Column(name = "enabled_quantity", nullable = false)
    private Integer enabledQuantity = 0;

    @Column(name = "operating_quantity", nullable = false)
    private Integer operatingQuantity = 0;

    @Column(name = "plate_number", nullable = false, length = 16)
    private String plateNumber = "";

    @Column(name = "ambulance_modality", length = 8)
    private String ambulanceModality;

    @Column(name = "vehicle_model", length = 4)
    private String vehicleModel;

    @Column(name = "property_card_number", length = 64)
    private String propertyCardNumber;

    @Column(name = "reps_cutoff_at")
    private Instant repsCutoffAt;

    @Column(name = "synced_from_reps", nullable = false)
    private boolean syncedFromReps;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public InstalledCapacity() {}

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

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public FacilityLocation getFacility() { return facility; }
    public void setFacility(FacilityLocation facility) { this.facility = facility; }
    public CapacityGroup getCapacityGroup() { return capacityGroup; }
    public void setCapacityGroup(CapacityGroup capacityGroup) { this.capacityGroup = capacityGroup; }
    public String getConceptCode() { return conceptCode; }
    public void setConceptCode(String conceptCode) { this.conceptCode = conceptCode; }
    public String getConceptName() { return conceptName; }
    public void setConceptName(String conceptName) { this.conceptName = conceptName; }
    public Integer getQuantity() { return quantity; }
    public void setQuantity(Integer quantity) { this.quantity = quantity; }
    public Integer getEnabledQuantity() { return enabledQuantity; }
    public void setEnabledQuantity(Integer enabledQuantity) { this.enabledQuantity = enabledQuantity; }
    public Integer getOperatingQuantity() { return operatingQuantity; }
    public void setOperatingQuantity(Integer operatingQuantity) { this.operatingQuantity = operatingQuantity; }
    public String getPlateNumber() { return plateNumber; }
    public void setPlateNumber(String plateNumber) { this.plateNumber = plateNumber; }
    public String getAmbulanceModality() { return ambulanceModality; }
    public void setAmbulanceModality(String ambulanceModality) { this.ambulanceModality = ambulanceModality; }
    public String getVehicleModel() { return vehicleModel; }
    public void setVehicleModel(String vehicleModel) { this.vehicleModel = vehicleModel; }
    public String getPropertyCardNumber() { return propertyCardNumber; }
    public void setPropertyCardNumber(String propertyCardNumber) { this.propertyCardNumber = propertyCardNumber; }
    public Instant getRepsCutoffAt() { return repsCutoffAt; }
    public void setRepsCutoffAt(Instant repsCutoffAt) { this.repsCutoffAt = repsCutoffAt; }
    public boolean isSyncedFromReps() { return syncedFromReps; }
    public void setSyncedFromReps(boolean syncedFromReps) { this.syncedFromReps = syncedFromReps; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public String getUpdatedBy() { return updatedBy; }
    public void setUpdatedBy(String updatedBy) { this.updatedBy = updatedBy; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
