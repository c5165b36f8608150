package com.saludsync.reps.dto;

import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.ComplexityLevel;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HabilitationStatus;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.model.OperationalStatus;
import com.saludsync.reps.model.ServiceStatus;
import com.saludsync.reps.model.SiteType;
import com.saludsync.reps.model.YesNo;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * JSON payload of a {@code RegistryBackup}. Services and capacities point at their facility by registry code,
 * since database ids are not preserved across a restore.
 */
public record RegistrySnapshot(Long organizationId,
                               Instant capturedAt,
                               List<FacilityRecord> facilities,
                               List<ServiceRecord> services,
                               List<CapacityRecord> capacities) {

    public RegistrySnapshot {
        // payloads written before capacity was tracked have no such field
        if (capacities == null) capacities = List.of();
    }

    public record FacilityRecord(Long id,
                                 String registryCode,
                                 String providerCode,
                                 String siteNumber,
                                 String name,
                                 SiteType siteType,
                                 String departmentCode,
                                 String departmentName,
                                 String municipalityCode,
                                 String municipalityName,
                                 String address,
                                 String phone,
                                 String email,
                                 String administrativeContact,
                                 HabilitationStatus habilitationStatus,
                                 OperationalStatus operationalStatus,
                                 LocalDate openingDate,
                                 LocalDate closingDate,
                                 boolean mainFacility,
                                 Instant deletedAt,
                                 String createdBy,
                                 Instant createdAt,
                                 String updatedBy,
                                 Instant updatedAt,
                                 Instant lastSyncAt,
                                 String syncStatus) {

        public static FacilityRecord of(FacilityLocation f) {
            return new FacilityRecord(f.getId(), f.getRegistryCode(), f.getProviderCode(), f.getSiteNumber(), f.getName(),
                    f.getSiteType(), f.getDepartmentCode(), f.getDepartmentName(), f.getMunicipalityCode(),
                    f.getMunicipalityName(), f.getAddress(), f.getPhone(), f.getEmail(), f.getAdministrativeContact(),
                    f.getHabilitationStatus(), f.getOperationalStatus(), f.getOpeningDate(), f.getClosingDate(),
                    f.isMainFacility(), f.getDeletedAt(), f.getCreatedBy(), f.getCreatedAt(), f.getUpdatedBy(),
                    f.getUpdatedAt(), f.getLastSyncAt(), f.getSyncStatus());
        }

        public FacilityLocation toEntity() {
            FacilityLocation f = new FacilityLocation();
            f.setRegistryCode(registryCode);
            f.setProviderCode(providerCode);
            f.setSiteNumber(siteNumber);
            f.setName(name);
            f.setSiteType(siteType);
            f.setDepartmentCode(departmentCode);
            f.setDepartmentName(departmentName);
            f.setMunicipalityCode(municipalityCode);
            f.setMunicipalityName(municipalityName);
            f.setAddress(address);
            f.setPhone(phone);
            f.setEmail(email);
            f.setAdministrativeContact(administrativeContact);
            f.setHabilitationStatus(habilitationStatus);
            f.setOperationalStatus(operationalStatus);
            f.setOpeningDate(openingDate);
            f.setClosingDate(closingDate);
            f.setMainFacility(mainFacility);
            f.setDeletedAt(deletedAt);
            f.setCreatedBy(createdBy);
            f.setCreatedAt(createdAt);
            f.setUpdatedBy(updatedBy);
            f.setUpdatedAt(updatedAt);
            f.setLastSyncAt(lastSyncAt);
            f.setSyncStatus(syncStatus);
            return f;
        }
    }

    public record ServiceRecord(Long id,
                                String facilityRegistryCode,
                                String serviceCode,
                                String serviceName,
                                String serviceGroupCode,
                                String serviceGroupName,
                                ComplexityLevel complexity,
                                YesNo ambulatory,
                                YesNo hospital,
                                YesNo mobileUnit,
                                YesNo domiciliary,
                                YesNo otherExtramural,
                                YesNo intramural,
                                YesNo telemedicine,
                                String distinctiveCode,
                                LocalDate habilitationDate,
                                LocalDate closingDate,
                                Integer installedCapacity,
                                ServiceStatus status,
                                Instant deletedAt,
                                String createdBy,
                                Instant createdAt,
                                String updatedBy,
                                Instant updatedAt,
                                Instant lastSyncAt,
                                String syncStatus) {

        public static ServiceRecord of(EnabledService s) {
            return new ServiceRecord(s.getId(), s.getFacility().getRegistryCode(), s.getServiceCode(), s.getServiceName(),
                    s.getServiceGroupCode(), s.getServiceGroupName(), s.getComplexity(), s.getAmbulatory(),
                    s.getHospital(), s.getMobileUnit(), s.getDomiciliary(), s.getOtherExtramural(), s.getIntramural(),
                    s.getTelemedicine(), s.getDistinctiveCode(), s.getHabilitationDate(), s.getClosingDate(),
                    s.getInstalledCapacity(), s.getStatus(), s.getDeletedAt(), s.getCreatedBy(), s.getCreatedAt(),
                    s.getUpdatedBy(), s.getUpdatedAt(), s.getLastSyncAt(), s.getSyncStatus());
        }

        public EnabledService toEntity(FacilityLocation facility) {
            EnabledService s = new EnabledService();
            s.setFacility(facility);
            s.setServiceCode(serviceCode);
            s.setServiceName(serviceName);
            s.setServiceGroupCode(serviceGroupCode);
            s.setServiceGroupName(serviceGroupName);
            s.setComplexity(complexity);
            s.setAmbulatory(ambulatory);
            s.setHospital(hospital);
            s.setMobileUnit(mobileUnit);
            s.setDomiciliary(domiciliary);
            s.setOtherExtramural(otherExtramural);
            s.setIntramural(intramural);
            s.setTelemedicine(telemedicine);
            s.setDistinctiveCode(distinctiveCode);
            s.setHabilitationDate(habilitationDate);
            s.setClosingDate(closingDate);
            s.setInstalledCapacity(installedCapacity);
            s.setStatus(status);
            s.setDeletedAt(deletedAt);
            s.setCreatedBy(createdBy);
            s.setCreatedAt(createdAt);
            s.setUpdatedBy(updatedBy);
            s.setUpdatedAt(updatedAt);
            s.setLastSyncAt(lastSyncAt);
            s.setSyncStatus(syncStatus);
            return s;
        }
    }

    public record CapacityRecord(String facilityRegistryCode,
                                 CapacityGroup capacityGroup,
                                 String conceptCode,
                                 String conceptName,
                                 Integer quantity,
                                 Integer enabledQuantity,
                                 Integer operatingQuantity,
                                 String plateNumber,
                                 String ambulanceModality,
                                 String vehicleModel,
                                 String propertyCardNumber,
                                 Instant repsCutoffAt,
                                 boolean syncedFromReps,
                                 String notes,
                                 String createdBy,
                                 Instant createdAt,
                                 String updatedBy,
                                 Instant updatedAt) {

        public static CapacityRecord of(InstalledCapacity c) {
            return new CapacityRecord(c.getFacility().getRegistryCode(), c.getCapacityGroup(), c.getConceptCode(),
                    c.getConceptName(), c.getQuantity(), c.getEnabledQuantity(), c.getOperatingQuantity(),
                    c.getPlateNumber(), c.getAmbulanceModality(), c.getVehicleModel(), c.getPropertyCardNumber(),
                    c.getRepsCutoffAt(), c.isSyncedFromReps(), c.getNotes(), c.getCreatedBy(), c.getCreatedAt(),
                    c.getUpdatedBy(), c.getUpdatedAt());
        }

        public InstalledCapacity toEntity(FacilityLocation facility) {
            InstalledCapacity c = new InstalledCapacity();
            c.setFacility(facility);
            c.setCapacityGroup(capacityGroup);
            c.setConceptCode(conceptCode);
            c.setConceptName(conceptName);
            c.setQuantity(quantity);
            c.setEnabledQuantity(enabledQuantity);
            c.setOperatingQuantity(operatingQuantity);
            c.setPlateNumber(plateNumber);
            c.setAmbulanceModality(ambulanceModality);
            c.setVehicleModel(vehicleModel);
            c.setPropertyCardNumber(propertyCardNumber);
            c.setRepsCutoffAt(repsCutoffAt);
            c.setSyncedFromReps(syncedFromReps);
            c.setNotes(notes);
            c.setCreatedBy(createdBy);
            c.setCreatedAt(createdAt);
            c.setUpdatedBy(updatedBy);
            c.setUpdatedAt(updatedAt);
            return c;
        }
    }
}
