package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.HabilitationStatus;
import com.saludsync.reps.model.HealthOrganization;
import com.saludsync.reps.model.OperationalStatus;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.model.SiteType;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FacilityMapperTest {

    private final RowValidator validator = new RowValidator();
    private final FacilityMapper mapper = new FacilityMapper();
    private final HealthOrganization org = new HealthOrganization("IPS Prueba", "900123456", "050010001");

    private RowValidationResult row(Map<String, String> overrides) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("codigo_prestador", "050010001");
        m.put("numero_sede", "02");
        m.put("nombre_sede", "Sede Norte");
        m.put("tipo_sede", "");
        m.put("departamento", "Antioquia");
        m.put("municipio", "Bello");
        m.put("codigo_municipio", "05088");
        m.put("direccion", "Carrera 50 # 1-2");
        m.put("telefono", "Tel 604 555 1234");
        m.put("email", "norte@ips.co");
        m.put("habilitado", "SI");
        m.put("fecha_apertura", "15/01/2020");
        m.putAll(overrides);
        return validator.validate(new RawRow(7, m), RowKind.FACILITIES);
    }

    @Test
    void toFacility_copiesRowAndBuildsNaturalKey() {
        List<String> warnings = new ArrayList<>();
        FacilityLocation f = mapper.toFacility(row(Map.of()), org, true, true, "ana", warnings);

        assertThat(f.getRegistryCode()).isEqualTo("050010001_02");
        assertThat(f.getProviderCode()).isEqualTo("050010001");
        assertThat(f.getSiteNumber()).isEqualTo("02");
        assertThat(f.getName()).isEqualTo("Sede Norte");
        assertThat(f.getOrganization()).isSameAs(org);
        assertThat(f.getDepartmentCode()).isEqualTo("05");
        assertThat(f.getMunicipalityCode()).isEqualTo("05088");
        assertThat(f.getPhone()).isEqualTo("604 555 1234");
        assertThat(f.getEmail()).isEqualTo("norte@ips.co");
        assertThat(f.getOpeningDate()).isEqualTo(LocalDate.of(2020, 1, 15));
        assertThat(f.getHabilitationStatus()).isEqualTo(HabilitationStatus.ENABLED);
        assertThat(f.getOperationalStatus()).isEqualTo(OperationalStatus.ACTIVE);
        assertThat(f.getCreatedBy()).isEqualTo("ana");
        assertThat(f.getUpdatedBy()).isEqualTo("ana");
        assertThat(f.getSyncStatus()).isEqualTo(FacilityMapper.SYNC_STATUS_IMPORTED);
        assertThat(f.getSiteType()).isEqualTo(SiteType.SATELLITE);
        assertThat(f.isMainFacility()).isFalse();
        assertThat(warnings).isEmpty();
    }

    @Test
    void firstFacilityOfAnOrganizationIsMain() {
        FacilityLocation f = mapper.toFacility(row(Map.of()), org, false, false, "ana", new ArrayList<>());
        assertThat(f.isMainFacility()).isTrue();
    }

    @Test
    void principalSiteBecomesMainOnlyWhenNoMainExists() {
        RowValidationResult principal = row(Map.of("tipo_sede", "Principal"));

        assertThat(mapper.toFacility(principal, org, true, false, "ana", new ArrayList<>()).isMainFacility()).isTrue();
        assertThat(mapper.toFacility(principal, org, true, true, "ana", new ArrayList<>()).isMainFacility()).isFalse();
    }

    @Test
    void siteTypeFallsBackToMainSiteNumber() {
        assertThat(mapper.resolveSiteType(row(Map.of("numero_sede_principal", "02")))).isEqualTo(SiteType.PRINCIPAL);
        assertThat(mapper.resolveSiteType(row(Map.of("numero_sede_principal", "01")))).isEqualTo(SiteType.SATELLITE);
    }

    @Test
    void departmentResolution() {
        FacilityLocation byCode = mapper.toFacility(row(Map.of("departamento", "5")), org, true, true, "ana", new ArrayList<>());
        assertThat(byCode.getDepartmentCode()).isEqualTo("05");
        assertThat(byCode.getDepartmentName()).isEqualTo("Antioquia");

        List<String> warnings = new ArrayList<>();
        FacilityLocation unknown = mapper.toFacility(
                row(Map.of("departamento", "Atlantida", "codigo_municipio", "")), org, true, true, "ana", warnings);
        assertThat(unknown.getDepartmentCode()).isNull();
        assertThat(unknown.getDepartmentName()).isEqualTo("Atlantida");
        assertThat(warnings).singleElement().asString()
                .isEqualTo("Fila 7: departamento 'Atlantida' no encontrado en DIVIPOLA");
    }

    @Test
    void applyRow_keepsIdentityAndMainFlag() {
        FacilityLocation existing = mapper.toFacility(row(Map.of()), org, false, false, "ana", new ArrayList<>());
        mapper.applyRow(existing, row(Map.of("nombre_sede", "Sede Norte Renovada", "habilitado", "Suspendida")),
                "luis", new ArrayList<>());

        assertThat(existing.getRegistryCode()).isEqualTo("050010001_02");
        assertThat(existing.isMainFacility()).isTrue();
        assertThat(existing.getName()).isEqualTo("Sede Norte Renovada");
        assertThat(existing.getCreatedBy()).isEqualTo("ana");
        assertThat(existing.getUpdatedBy()).isEqualTo("luis");
        assertThat(existing.getOperationalStatus()).isEqualTo(OperationalStatus.TEMPORARILY_CLOSED);
    }
}
