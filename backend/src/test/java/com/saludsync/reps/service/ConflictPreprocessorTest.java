package com.saludsync.reps.service;

import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.EnabledService;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.support.RegistryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(RegistryTestData.class)
class ConflictPreprocessorTest {

    @Autowired private ConflictPreprocessor preprocessor;
    @Autowired private RegistryTestData testData;
    @Autowired private FacilityLocationRepository facilityRepository;
    @Autowired private EnabledServiceRepository serviceRepository;
    @Autowired private InstalledCapacityRepository capacityRepository;

    private HealthOrganization org;

    @BeforeEach
    void setUp() {
        testData.wipe();
        org = testData.organization("800100200");
    }

    private FacilityLocation tombstone(FacilityLocation f) {
        f.setDeletedAt(Instant.now());
        return facilityRepository.save(f);
    }

    private EnabledService tombstone(EnabledService s) {
        s.setDeletedAt(Instant.now());
        return serviceRepository.save(s);
    }

    @Test
    void purgesOnlyTombstonedFacilitiesInTheIncomingKeySet() {
        FacilityLocation colliding = tombstone(testData.facility(org, "K1", "Vieja", false));
        testData.service(colliding, "328", "Medicina general");
        testData.capacity(colliding, CapacityGroup.BEDS, "101", 4);
        tombstone(testData.facility(org, "K9", "Otra vieja", false));
        testData.facility(org, "K2", "Activa", true);

        int purged = preprocessor.purgeFacilityTombstones(org.getId(), List.of("K1", "K2", "K3"));

        assertThat(purged).isEqualTo(1);
        assertThat(facilityRepository.findByOrganizationIdAndRegistryCode(org.getId(), "K1")).isEmpty();
        assertThat(facilityRepository.findByOrganizationIdAndRegistryCode(org.getId(), "K9")).isPresent();
        assertThat(facilityRepository.findByOrganizationIdAndRegistryCode(org.getId(), "K2")).isPresent();
        assertThat(serviceRepository.countByOrganization(org.getId())).isZero();
        assertThat(capacityRepository.countByOrganization(org.getId())).isZero();
    }

    @Test
    void doesNotTouchOtherOrganizations() {
        HealthOrganization other = testData.organization("800999999");
        tombstone(testData.facility(other, "K1", "Ajena", false));

        assertThat(preprocessor.purgeFacilityTombstones(org.getId(), List.of("K1"))).isZero();
        assertThat(facilityRepository.findByOrganizationIdAndRegistryCode(other.getId(), "K1")).isPresent();
    }

    @Test
    void purgesExactServicePairsOnly() {
        FacilityLocation a = testData.facility(org, "A", "Sede A", true);
        FacilityLocation b = testData.facility(org, "B", "Sede B", false);
        EnabledService a328 = tombstone(testData.service(a, "328", "Medicina general"));
        EnabledService b334 = tombstone(testData.service(b, "334", "Odontología"));
        EnabledService b328 = tombstone(testData.service(b, "328", "Medicina general"));

        int purged = preprocessor.purgeServiceTombstones(org.getId(), Map.of("A", Set.of("328"), "B", Set.of("334")));

        assertThat(purged).isEqualTo(2);
        assertThat(serviceRepository.findById(a328.getId())).isEmpty();
        assertThat(serviceRepository.findById(b334.getId())).isEmpty();
        assertThat(serviceRepository.findById(b328.getId())).as("B/328 was not in the incoming file").isPresent();
    }

    @Test
    void emptyInputIsANoOp() {
        assertThat(preprocessor.purgeFacilityTombstones(org.getId(), List.of())).isZero();
        assertThat(preprocessor.purgeServiceTombstones(org.getId(), Map.of())).isZero();
    }
}
