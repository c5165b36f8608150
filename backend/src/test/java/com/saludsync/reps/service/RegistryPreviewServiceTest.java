package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.dto.RegistryPreviewResponse;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.dto.SyncFile;
import com.saludsync.reps.model.RowKind;
import com.saludsync.reps.service.RowValidator.RowValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistryPreviewServiceTest {

    @Mock
    private RepsTableReader tableReader;
    @Mock
    private RowValidator rowValidator;
    @Mock
    private FacilityMapper facilityMapper;

    @InjectMocks
    private RegistryPreviewService previewService;

    private final SyncFile file = new SyncFile("sedes.xls", "<table></table>".getBytes(StandardCharsets.UTF_8));

    private static RepsTable tableOf(int rows) {
        List<RawRow> raw = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            raw.add(new RawRow(i + 2, Map.of("nombre", "Sede " + i)));
        }
        return new RepsTable("sedes.xls", List.of("nombre"), raw);
    }

    @Test
    void clampsLimitAndReportsTotalRows() {
        when(tableReader.read(any(byte[].class), eq("sedes.xls"))).thenReturn(tableOf(25));
        when(rowValidator.validate(any(), eq(RowKind.FACILITIES))).thenAnswer(inv -> {
            RawRow row = inv.getArgument(0);
            return new RowValidationResult(row.getRowIndex(), true, row.getCells(), List.of());
        });
        when(facilityMapper.naturalKey(any(RowValidationResult.class))).thenReturn("7600103066_1");

        RegistryPreviewResponse response = previewService.preview(RowKind.FACILITIES, file, 500);

        assertThat(response.getTotalRows()).isEqualTo(25);
        assertThat(response.getRows()).hasSize(RegistryPreviewService.MAX_PREVIEW_ROWS);
        assertThat(response.getRows().get(0).getLine()).isEqualTo(2);
        assertThat(response.getRows()).allSatisfy(r -> {
            assertThat(r.getStatus()).isEqualTo("ok");
            assertThat(r.getReason()).isNull();
        });
    }

    @Test
    void invalidRowsCarryTheMissingFields() {
        when(tableReader.read(any(byte[].class), eq("sedes.xls"))).thenReturn(tableOf(1));
        when(rowValidator.validate(any(), eq(RowKind.FACILITIES)))
                .thenReturn(new RowValidationResult(2, false, Map.of(), List.of("departamento", "municipio")));

        RegistryPreviewResponse response = previewService.preview(RowKind.FACILITIES, file, 5);

        RegistryPreviewResponse.PreviewRow row = response.getRows().get(0);
        assertThat(row.getStatus()).isEqualTo("error");
        assertThat(row.getReason()).isEqualTo("campos requeridos faltantes: departamento, municipio");
        assertThat(row.getRegistryCode()).isNull();
        verifyNoInteractions(facilityMapper);
    }

    @Test
    void malformedRegistryCodeIsReportedOnAValidRow() {
        when(tableReader.read(any(byte[].class), eq("sedes.xls"))).thenReturn(tableOf(1));
        when(rowValidator.validate(any(), eq(RowKind.FACILITIES)))
                .thenReturn(new RowValidationResult(2, true, Map.of(), List.of()));
        when(facilityMapper.naturalKey(any(RowValidationResult.class))).thenReturn("76001 03066_1");

        RegistryPreviewResponse.PreviewRow row = previewService.preview(RowKind.FACILITIES, file, 5).getRows().get(0);

        assertThat(row.getStatus()).isEqualTo("ok");
        assertThat(row.getReason()).isNotBlank();
    }

    @Test
    void rejectsRunKind() {
        assertThatThrownBy(() -> previewService.preview(RowKind.RUN, file, 5))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(tableReader);
    }
}
