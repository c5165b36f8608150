package com.saludsync.reps.repository;

import com.saludsync.reps.model.InstalledCapacity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface InstalledCapacityRepository extends JpaRepository<InstalledCapacity, Long> {

    Optional<InstalledCapacity> findByFacilityIdAndConceptCodeAndPlateNumber(Long facilityId, String conceptCode, String plateNumber);

    @Query("select c from InstalledCapacity c join fetch c.facility f where f.organization.id = :orgId order by f.registryCode, c.conceptCode, c.plateNumber")
    List<InstalledCapacity> findAllByOrganization(@Param("orgId") Long orgId);

    @Query("select count(c) from InstalledCapacity c where c.facility.organization.id = :orgId")
    long countByOrganization(@Param("orgId") Long orgId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from InstalledCapacity c where c.facility.id in (select f.id from FacilityLocation f where f.organization.id = :orgId and f.deletedAt is not null and f.registryCode in :codes)")
    int deleteUnderTombstonedFacilities(@Param("orgId") Long orgId, @Param("codes") Collection<String> registryCodes);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from InstalledCapacity c where c.facility.id in (select f.id from FacilityLocation f where f.organization.id = :orgId)")
    int deleteAllByOrganization(@Param("orgId") Long orgId);
}
