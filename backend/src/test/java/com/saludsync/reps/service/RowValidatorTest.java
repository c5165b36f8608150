package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import com.saludsync.reps.util.RepsColumns;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RowValidatorTest {

    private final RowValidator validator = new RowValidator();

    private static Map<String, String> completeFacility() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("codigo_prestador", "050010001");
        m.put("numero_sede", "1.0");
        m.put("nombre_sede", "ClÃ\u00adnica Central");
        m.put("departamento", "Antioquia");
        m.put("municipio", "MedellÃ\u00adn");
        m.put("direccion", "Calle 10");
        return m;
    }

    @Test
    void completeRowIsValidAndNormalized() {
        RowValidationResult r = validator.validate(new RawRow(4, completeFacility()), RowKind.FACILITIES);

        assertThat(r.isValid()).isTrue();
        assertThat(r.getErrors()).isEmpty();
        assertThat(r.getRowIndex()).isEqualTo(4);
        assertThat(r.get(RepsColumns.SITE_NUMBER)).isEqualTo("1");
        assertThat(r.get(RepsColumns.SITE_NAME)).isEqualTo("Clínica Central");
        assertThat(r.get(RepsColumns.MUNICIPALITY)).isEqualTo("Medellín");
        assertThat(r.get(RepsColumns.PHONE)).isEmpty();
    }

    @Test
    void missingFieldsAreAllReported() {
        Map<String, String> m = completeFacility();
        m.put("departamento", "nan");
        m.remove("direccion");

        RowValidationResult r = validator.validate(new RawRow(2, m), RowKind.FACILITIES);

        assertThat(r.isValid()).isFalse();
        assertThat(r.getErrors()).containsExactly(RepsColumns.DEPARTMENT, RepsColumns.ADDRESS);
    }

    @Test
    void serviceRowsAlsoNeedServiceCodeAndName() {
        RowValidationResult r = validator.validate(new RawRow(1, completeFacility()), RowKind.SERVICES);

        assertThat(r.isValid()).isFalse();
        assertThat(r.getErrors()).containsExactly(RepsColumns.SERVICE_CODE, RepsColumns.SERVICE_NAME);
        assertThat(RowValidator.requiredFields(RowKind.SERVICES)).containsAll(RowValidator.requiredFields(RowKind.FACILITIES));
    }
}
