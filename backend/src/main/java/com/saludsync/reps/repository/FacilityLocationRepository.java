package com.saludsync.reps.repository;

import com.saludsync.reps.model.FacilityLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FacilityLocationRepository extends JpaRepository<FacilityLocation, Long> {

    Optional<FacilityLocation> findByOrganizationIdAndRegistryCodeAndDeletedAtIsNull(Long organizationId, String registryCode);

    Optional<FacilityLocation> findByOrganizationIdAndRegistryCode(Long organizationId, String registryCode);

    List<FacilityLocation> findByOrganizationId(Long organizationId);

    List<FacilityLocation> findByOrganizationIdAndDeletedAtIsNull(Long organizationId);

    List<FacilityLocation> findByOrganizationIdAndProviderCodeAndDeletedAtIsNull(Long organizationId, String providerCode);

    boolean existsByOrganizationIdAndDeletedAtIsNull(Long organizationId);

    boolean existsByOrganizationIdAndMainFacilityTrueAndDeletedAtIsNull(Long organizationId);

    long countByOrganizationIdAndMainFacilityTrueAndDeletedAtIsNull(Long organizationId);

    long countByOrganizationId(Long organizationId);

    // name/address are expected already trimmed and lower-cased by the caller
    @Query("select f from FacilityLocation f where f.organization.id = :orgId and f.deletedAt is null and lower(trim(f.name)) = :name and lower(trim(f.address)) = :address")
    List<FacilityLocation> findActiveByNameAndAddress(@Param("orgId") Long orgId,
                                                      @Param("name") String name,
                                                      @Param("address") String address);

    @Query("select f.registryCode from FacilityLocation f where f.organization.id = :orgId and f.deletedAt is not null and f.registryCode in :codes")
    List<String> findTombstonedCodes(@Param("orgId") Long orgId, @Param("codes") Collection<String> codes);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from FacilityLocation f where f.organization.id = :orgId and f.deletedAt is not null and f.registryCode in :codes")
    int deleteTombstonedByCodes(@Param("orgId") Long orgId, @Param("codes") Collection<String> codes);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from FacilityLocation f where f.organization.id = :orgId")
    int deleteAllByOrganization(@Param("orgId") Long orgId);
}
