package com.saludsync.reps.service;

import com.saludsync.reps.exception.BackupRestoreException;
import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.RegistryBackup;
import com.saludsync.reps.repository.EnabledServiceRepository;
import com.saludsync.reps.repository.FacilityLocationRepository;
import com.saludsync.reps.repository.InstalledCapacityRepository;
import com.saludsync.reps.repository.RegistryBackupRepository;
import com.saludsync.reps.support.RegistryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(RegistryTestData.class)
class BackupManagerIntegrationTest {

    @Autowired private BackupManager backupManager;
    @Autowired private RegistryTestData testData;
    @Autowired private RegistryBackupRepository backupRepository;
    @Autowired private FacilityLocationRepository facilityRepository;
    @Autowired private EnabledServiceRepository serviceRepository;
    @Autowired private InstalledCapacityRepository capacityRepository;

    private HealthOrganization org;

    @BeforeEach
    void setUp() {
        testData.wipe();
        org = testData.organization("900111222");
        FacilityLocation main = testData.facility(org, "900111222_1", "Sede Principal", true);
        FacilityLocation other = testData.facility(org, "900111222_2", "Sede Cerrada", false);
        other.setDeletedAt(Instant.parse("2024-05-01T00:00:00Z"));
        facilityRepository.save(other);
        testData.service(main, "328", "Medicina general");
        testData.service(main, "334", "Odontología general");
        testData.capacity(main, CapacityGroup.BEDS, "101", 12);
    }

    @Test
    void captureRecordsFacilitiesIncludingTombstonesAndServices() {
        String id = backupManager.capture(org.getId());

        RegistryBackup backup = backupRepository.findById(id).orElseThrow();
        assertThat(backup.getOrganizationId()).isEqualTo(org.getId());
        assertThat(backup.getFacilityCount()).isEqualTo(2);
        assertThat(backup.getServiceCount()).isEqualTo(2);
        assertThat(backup.getCapacityCount()).isEqualTo(1);
        assertThat(backup.isConsumed()).isFalse();
        assertThat(backup.getPayload()).contains("900111222_1", "Odontología general");
    }

    @Test
    void restorePutsBackTheCapturedState() {
        String id = backupManager.capture(org.getId());
        testData.clearRegistry(org);
        assertThat(facilityRepository.countByOrganizationId(org.getId())).isZero();
        testData.facility(org, "900111222_9", "Intrusa", true);

        backupManager.restore(id);

        List<FacilityLocation> facilities = facilityRepository.findByOrganizationId(org.getId());
        assertThat(facilities).extracting(FacilityLocation::getRegistryCode)
                .containsExactlyInAnyOrder("900111222_1", "900111222_2");
        assertThat(facilities).filteredOn(FacilityLocation::isActive).singleElement()
                .satisfies(f -> {
                    assertThat(f.isMainFacility()).isTrue();
                    assertThat(f.getCreatedBy()).isEqualTo("seed");
                });
        assertThat(serviceRepository.findAllByOrganization(org.getId()))
                .extracting(s -> s.getFacility().getRegistryCode() + "/" + s.getServiceCode())
                .containsExactly("900111222_1/328", "900111222_1/334");
        assertThat(capacityRepository.findAllByOrganization(org.getId())).singleElement()
                .satisfies(c -> {
                    assertThat(c.getFacility().getRegistryCode()).isEqualTo("900111222_1");
                    assertThat(c.getCapacityGroup()).isEqualTo(CapacityGroup.BEDS);
                    assertThat(c.getQuantity()).isEqualTo(12);
                });
        assertThat(backupRepository.findById(id).orElseThrow().isConsumed()).isTrue();
    }

    @Test
    void backupCanOnlyBeRestoredOnce() {
        String id = backupManager.capture(org.getId());
        backupManager.restore(id);

        assertThatThrownBy(() -> backupManager.restore(id))
                .isInstanceOf(BackupRestoreException.class)
                .hasMessageContaining("already restored");
    }

    @Test
    void unknownBackupCannotBeRestored() {
        assertThatThrownBy(() -> backupManager.restore("no-such-backup"))
                .isInstanceOf(BackupRestoreException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void discardRemovesTheSnapshotUnlessBackupsAreKept() {
        String id = backupManager.capture(org.getId());

        backupManager.discard(id);

        assertThat(backupRepository.findById(id)).isEmpty();
    }
}
