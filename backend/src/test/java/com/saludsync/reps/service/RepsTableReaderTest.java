package com.saludsync.reps.service;

import com.saludsync.reps.dto.RawRow;
import com.saludsync.reps.dto.RepsTable;
import com.saludsync.reps.exception.RepsParsingException;
import com.saludsync.reps.support.RepsHtml;
import com.saludsync.reps.util.RepsColumns;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepsTableReaderTest {

    private final RepsTableReader reader = new RepsTableReader();

    @Test
    void readsHeaderAndDataRows() {
        byte[] html = RepsHtml.bytes(RepsHtml.FACILITY_HEADERS, List.of(
                RepsHtml.facility("050010001", "1", "Sede Central", "Principal", "Antioquia", "Medellín", "Calle 10 # 20-30"),
                RepsHtml.facility("050010001", "2", "Sede Norte", "", "Antioquia", "Bello", "Carrera 50 # 1-2")));

        RepsTable table = reader.read(html, "sedes.xls");

        assertThat(table.getFileName()).isEqualTo("sedes.xls");
        assertThat(table.getHeaders()).hasSize(RepsHtml.FACILITY_HEADERS.size());
        assertThat(table.size()).isEqualTo(2);
        RawRow first = table.rows().get(0);
        assertThat(first.getRowIndex()).isEqualTo(1);
        assertThat(first.get(RepsColumns.SITE_NAME)).isEqualTo("Sede Central");
        assertThat(first.get(RepsColumns.MUNICIPALITY)).isEqualTo("Medellín");
    }

    @Test
    void headerAliasesAndAccentsResolveToCanonicalNames() {
        byte[] html = RepsHtml.bytes(
                List.of("Código Habilitación", "Número Sede", "Nombre Sede", "Depa Nombre", "Muni Nombre", "Dirección"),
                List.of(List.of("76001", "3", "IPS Sur", "Valle del Cauca", "Cali", "Av 5")));

        RawRow row = reader.read(html, "x.xls").rows().get(0);

        assertThat(row.get(RepsColumns.PROVIDER_CODE)).isEqualTo("76001");
        assertThat(row.get(RepsColumns.DEPARTMENT)).isEqualTo("Valle del Cauca");
        assertThat(row.get(RepsColumns.ADDRESS)).isEqualTo("Av 5");
        assertThat(row.get(RepsColumns.EMAIL)).isNull();
    }

    @Test
    void blankRowsAreDroppedButKeepTheirPosition() {
        byte[] html = RepsHtml.bytes(List.of("codigo_prestador", "nombre_sede"), List.of(
                List.of("1", "A"),
                List.of("", "nan"),
                List.of("3", "C")));

        RepsTable table = reader.read(html, "x.xls");

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.rows().get(1).getRowIndex()).isEqualTo(3);
    }

    @Test
    void leadingEmptyRowsAreSkippedBeforeTheHeader() {
        String html = "<table><tr><td></td><td></td></tr><tr><th>codigo_prestador</th><th>nombre_sede</th></tr>"
                + "<tr><td>1</td><td>A</td></tr></table>";

        RepsTable table = reader.read(html.getBytes(StandardCharsets.UTF_8), "x.xls");

        assertThat(table.getHeaders()).containsExactly("codigo_prestador", "nombre_sede");
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void shortRowsArePaddedAndDuplicateHeadersRenamed() {
        String html = "<table><tr><th>nombre_sede</th><th>nombre_sede</th><th></th></tr>"
                + "<tr><td>A</td></tr></table>";

        RawRow row = reader.read(html.getBytes(StandardCharsets.UTF_8), "x.xls").rows().get(0);

        assertThat(row.getCells()).containsKeys("nombre_sede", "nombre_sede_2", "column_3");
        assertThat(row.getCells().get("nombre_sede_2")).isEmpty();
    }

    @Test
    void fallsBackToWindows1252() {
        byte[] html = RepsHtml.bytes(List.of("codigo_prestador", "municipio"),
                List.of(List.of("1", "Medellín")), Charset.forName("windows-1252"));

        assertThat(reader.read(html, "x.xls").rows().get(0).get(RepsColumns.MUNICIPALITY)).isEqualTo("Medellín");
    }

    @Test
    void stripsUtf8Bom() {
        byte[] body = RepsHtml.bytes(List.of("codigo_prestador"), List.of(List.of("1")));
        byte[] withBom = new byte[body.length + 3];
        withBom[0] = (byte) 0xEF;
        withBom[1] = (byte) 0xBB;
        withBom[2] = (byte) 0xBF;
        System.arraycopy(body, 0, withBom, 3, body.length);

        assertThat(reader.read(new ByteArrayInputStream(withBom), "x.xls").size()).isEqualTo(1);
    }

    @Test
    void rejectsFilesWithoutUsableTable() {
        assertThatThrownBy(() -> reader.read(new byte[0], "vacio.xls"))
                .isInstanceOf(RepsParsingException.class)
                .hasMessageContaining("vacío");
        assertThatThrownBy(() -> reader.read("<html><p>hola</p></html>".getBytes(StandardCharsets.UTF_8), "p.xls"))
                .isInstanceOf(RepsParsingException.class)
                .hasMessageContaining("tabla");
        assertThatThrownBy(() -> reader.read(RepsHtml.bytes(List.of("codigo_prestador"), List.of()), "h.xls"))
                .isInstanceOf(RepsParsingException.class)
                .satisfies(e -> assertThat(((RepsParsingException) e).getFileName()).isEqualTo("h.xls"));
    }
}
