package com.saludsync.reps.support;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Builds REPS-style HTML "xls" exports for tests. */
public final class RepsHtml {

    private RepsHtml() {}

    public static final List<String> FACILITY_HEADERS = List.of(
            "codigo_prestador", "numero_sede", "nombre_sede", "tipo_sede", "departamento", "municipio",
            "direccion", "telefono", "email", "gerente", "habilitado", "fecha_apertura");

    public static final List<String> SERVICE_HEADERS = List.of(
            "codigo_prestador", "numero_sede", "nombre_sede", "departamento", "municipio", "direccion",
            "serv_codigo", "serv_nombre", "grse_codigo", "grse_nombre", "ambulatorio", "hospitalario",
            "complejidad_baja", "complejidad_media", "complejidad_alta", "complejidades", "habilitado");

    // headers as the portal writes them; the reader turns them into column keys
    public static final List<String> CAPACITY_HEADERS = List.of(
            "depa_nombre", "muni_nombre", "habi_codigo_habilitacion", "numero_sede", "sede_nombre",
            "grupo_capacidad", "coca_codigo", "coca_nombre", "cantidad", "Número de placa", "modalidad", "modelo",
            "numero_tarjeta");

    public static String table(List<String> headers, List<List<String>> rows) {
        StringBuilder sb = new StringBuilder("<html><body><table>\n<tr>");
        headers.forEach(h -> sb.append("<th>").append(h).append("</th>"));
        sb.append("</tr>\n");
        for (List<String> row : rows) {
            sb.append("<tr>");
            row.forEach(c -> sb.append("<td>").append(c).append("</td>"));
            sb.append("</tr>\n");
        }
        return sb.append("</table></body></html>").toString();
    }

    public static byte[] bytes(List<String> headers, List<List<String>> rows) {
        return table(headers, rows).getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] bytes(List<String> headers, List<List<String>> rows, Charset charset) {
        return table(headers, rows).getBytes(charset);
    }

    public static List<String> facility(String provider, String site, String name, String type,
                                        String department, String municipality, String address) {
        return List.of(provider, site, name, type, department, municipality, address,
                "6041234567", "sede@ips.com.co", "Gerente", "SI", "2020-01-15");
    }

    public static List<String> service(String provider, String site, String name, String code, String serviceName,
                                       String complexity) {
        return List.of(provider, site, name, "Antioquia", "Medellín", "Calle 1 # 2-3",
                code, serviceName, "1", "Consulta externa", "SI", "NO", "", "", "", complexity, "SI");
    }

    public static List<String> capacity(String provider, String site, String siteName, String group,
                                        String conceptCode, String concept, String quantity) {
        return List.of("Antioquia", "Medellín", provider, site, siteName, group, conceptCode, concept, quantity,
                "", "", "", "");
    }

    public static List<String> ambulance(String provider, String site, String siteName, String plate,
                                         String modality, String model) {
        return List.of("Antioquia", "Medellín", provider, site, siteName, "AMBULANCIAS", "601", "Ambulancia", "1",
                plate, modality, model, "TP-" + plate);
    }
}
