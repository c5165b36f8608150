package com.saludsync.reps.support;

import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.repository.CapacityImportLogRepository;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.HealthOrganizationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.repository.RegistryBackupRepository;
import com.saludsync.reps.repository.SyncRunErrorRepository;
import com.saludsync.reps.repository.SyncRunRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestComponent;
import org.springframework.transaction.annotation.Transactional;

/** Seeds and empties registry tables for integration tests. */
@TestComponent
public class RegistryTestData {

    @Autowired private SyncRunErrorRepository syncRunErrorRepository;
    @Autowired private SyncRunRepository syncRunRepository;
    @Autowired private RegistryBackupRepository registryBackupRepository;
    @Autowired private CapacityImportLogRepository capacityImportLogRepository;
    @Autowired private InstalledCapacityRepository installedCapacityRepository;
    @Autowired private EnabledServiceRepository enabledServiceRepository;
    @Autowired private FacilityLocationRepository facilityLocationRepository;
    @Autowired private HealthOrganizationRepository healthOrganizationRepository;

    public HealthOrganization organization(String nit) {
        return healthOrganizationRepository.save(new HealthOrganization("IPS " + nit, nit, nit));
    }

    public FacilityLocation facility(HealthOrganization org, String registryCode, String name, boolean main) {
        FacilityLocation f = new FacilityLocation();
        f.setOrganization(org);
        f.setRegistryCode(registryCode);
        f.setName(name);
        f.setAddress("Calle " + registryCode);
        f.setMainFacility(main);
        f.setCreatedBy("seed");
        return facilityLocationRepository.save(f);
    }

    public EnabledService service(FacilityLocation facility, String code, String name) {
        EnabledService s = new EnabledService();
        s.setFacility(facility);
        s.setServiceCode(code);
        s.setServiceName(name);
        s.setCreatedBy("seed");
        return enabledServiceRepository.save(s);
    }

    public InstalledCapacity capacity(FacilityLocation facility, CapacityGroup group, String conceptCode, int quantity) {
        InstalledCapacity c = new InstalledCapacity();
        c.setFacility(facility);
        c.setCapacityGroup(group);
        c.setConceptCode(conceptCode);
        c.setConceptName("Concepto " + conceptCode);
        c.setQuantity(quantity);
        c.setEnabledQuantity(quantity);
        c.setOperatingQuantity(quantity);
        c.setCreatedBy("seed");
        return installedCapacityRepository.save(c);
    }

    /** Hard-deletes every facility, service and capacity of the organization, as a force recreate would. */
    @Transactional
    public void clearRegistry(HealthOrganization org) {
        installedCapacityRepository.deleteAllByOrganization(org.getId());
        enabledServiceRepository.deleteAllByOrganization(org.getId());
        facilityLocationRepository.deleteAllByOrganization(org.getId());
    }

    /** Children first. */
    public void wipe() {
        syncRunErrorRepository.deleteAllInBatch();
        syncRunRepository.deleteAllInBatch();
        registryBackupRepository.deleteAllInBatch();
        capacityImportLogRepository.deleteAllInBatch();
        installedCapacityRepository.deleteAllInBatch();
        enabledServiceRepository.deleteAllInBatch();
        facilityLocationRepository.deleteAllInBatch();
        healthOrganizationRepository.deleteAllInBatch();
    }
}
