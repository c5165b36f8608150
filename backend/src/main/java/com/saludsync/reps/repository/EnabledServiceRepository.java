package com.saludsync.reps.repository;

import com.saludsync.reps.model.EnabledService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EnabledServiceRepository extends JpaRepository<EnabledService, Long> {

    Optional<EnabledService> findByFacilityIdAndServiceCodeAndDeletedAtIsNull(Long facilityId, String serviceCode);

    Optional<EnabledService> findByFacilityIdAndServiceCode(Long facilityId, String serviceCode);

    @Query("select s from EnabledService s join fetch s.facility f where f.organization.id = :orgId order by f.registryCode, s.serviceCode")
    List<EnabledService> findAllByOrganization(@Param("orgId") Long orgId);

    @Query("select count(s) from EnabledService s where s.facility.organization.id = :orgId")
    long countByOrganization(@Param("orgId") Long orgId);

    @Query("select s from EnabledService s join fetch s.facility f where f.organization.id = :orgId and s.deletedAt is not null and f.registryCode in :codes and s.serviceCode in :serviceCodes")
    List<EnabledService> findTombstonedCandidates(@Param("orgId") Long orgId,
                                                  @Param("codes") Collection<String> registryCodes,
                                                  @Param("serviceCodes") Collection<String> serviceCodes);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from EnabledService s where s.id in :ids")
    int deleteByIds(@Param("ids") Collection<Long> ids);

    // services hanging off tombstoned facilities that are about to be purged
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from EnabledService s where s.facility.id in (select f.id from FacilityLocation f where f.organization.id = :orgId and f.deletedAt is not null and f.registryCode in :codes)")
    int deleteUnderTombstonedFacilities(@Param("orgId") Long orgId, @Param("codes") Collection<String> registryCodes);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from EnabledService s where s.facility.id in (select f.id from FacilityLocation f where f.organization.id = :orgId)")
    int deleteAllByOrganization(@Param("orgId") Long orgId);
}
