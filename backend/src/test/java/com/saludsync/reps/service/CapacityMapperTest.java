package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.exception.RowCreationException;
import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.FacilityLocation;
import com.saludsync.reps.model.InstalledCapacity;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapacityMapperTest {

    private final RowValidator validator = new RowValidator();
    private final CapacityMapper mapper = new CapacityMapper();
    private final FacilityLocation facility = new FacilityLocation();

    private RowValidationResult row(Map<String, String> overrides) {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("habi_codigo_habilitacion", "050010001");
        m.put("numero_sede", "1");
        m.put("sede_nombre", "Sede Central");
        m.put("grupo_capacidad", "CAMAS");
        m.put("coca_codigo", "101");
        m.put("coca_nombre", "Adultos");
        m.put("cantidad", "12");
        m.putAll(overrides);
        return validator.validate(new RawRow(4, m), RowKind.CAPACITY);
    }

    @Test
    void toCapacity_takesAllOfTheQuantityAsEnabledAndOperating() {
        List<String> warnings = new ArrayList<>();
        RowValidationResult r = row(Map.of());

        InstalledCapacity c = mapper.toCapacity(r, facility, mapper.resolveGroup(r, warnings), "capacidad.xls", "ana", warnings);

        assertThat(c.getFacility()).isSameAs(facility);
        assertThat(c.getCapacityGroup()).isEqualTo(CapacityGroup.BEDS);
        assertThat(c.getConceptCode()).isEqualTo("101");
        assertThat(c.getConceptName()).isEqualTo("Adultos");
        assertThat(c.getQuantity()).isEqualTo(12);
        assertThat(c.getEnabledQuantity()).isEqualTo(12);
        assertThat(c.getOperatingQuantity()).isEqualTo(12);
        assertThat(c.getPlateNumber()).isEmpty();
        assertThat(c.getAmbulanceModality()).isNull();
        assertThat(c.isSyncedFromReps()).isTrue();
        assertThat(c.getNotes()).isEqualTo("Importado desde REPS - capacidad.xls");
        assertThat(c.getCreatedBy()).isEqualTo("ana");
        assertThat(warnings).isEmpty();
    }

    @Test
    void unknownGroupFallsBackToOtherWithAWarning() {
        List<String> warnings = new ArrayList<>();

        assertThat(mapper.resolveGroup(row(Map.of("grupo_capacidad", "PARQUEADEROS")), warnings)).isEqualTo(CapacityGroup.OTHER);
        assertThat(warnings).singleElement().asString().startsWith("Fila 4:").contains("PARQUEADEROS");
    }

    @Test
    void missingConceptCodeIsDerivedFromGroupAndConcept() {
        RowValidationResult r = row(Map.of("coca_codigo", "", "coca_nombre", "Cuidado intensivo adulto"));

        assertThat(mapper.conceptCode(r, CapacityGroup.BEDS)).isEqualTo("CAM_CUIDADO_IN");
    }

    @Test
    void ambulanceKeepsModalityAndShortModel() {
        List<String> warnings = new ArrayList<>();
        RowValidationResult r = row(Map.of("grupo_capacidad", "AMBULANCIA", "numero_placa", "abc123",
                "modalidad", "tab", "modelo", "2019-A"));

        InstalledCapacity c = mapper.toCapacity(r, facility, mapper.resolveGroup(r, warnings), "capacidad.xls", "ana", warnings);

        assertThat(c.getCapacityGroup()).isEqualTo(CapacityGroup.AMBULANCES);
        assertThat(c.getPlateNumber()).isEqualTo("ABC123");
        assertThat(c.getAmbulanceModality()).isEqualTo("TAB");
        assertThat(c.getVehicleModel()).isEqualTo("2019");
    }

    @Test
    void modalityIsIgnoredOutsideAmbulances() {
        List<String> warnings = new ArrayList<>();
        RowValidationResult r = row(Map.of("modalidad", "TAB"));

        InstalledCapacity c = mapper.toCapacity(r, facility, CapacityGroup.BEDS, "capacidad.xls", "ana", warnings);

        assertThat(c.getAmbulanceModality()).isNull();
    }

    @Test
    void negativeQuantityRejectsTheRow() {
        assertThatThrownBy(() -> mapper.quantity(row(Map.of("cantidad", "-3")), new ArrayList<>()))
                .isInstanceOf(RowCreationException.class)
                .hasMessage("la cantidad no puede ser negativa");
    }

    @Test
    void nonNumericQuantityBecomesZeroWithAWarning() {
        List<String> warnings = new ArrayList<>();

        assertThat(mapper.quantity(row(Map.of("cantidad", "doce")), warnings)).isZero();
        assertThat(mapper.quantity(row(Map.of("cantidad", "")), warnings)).isZero();
        assertThat(warnings).hasSize(1);
    }
}
