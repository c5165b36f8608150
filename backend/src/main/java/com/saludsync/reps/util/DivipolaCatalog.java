package com.saludsync.reps.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * DIVIPOLA department codes (DANE). REPS exports carry the department either as its name or as the
 * two-digit code, and municipality codes start with the department code.
 */
public final class DivipolaCatalog {

    private DivipolaCatalog() {}

    private static final Map<String, String> NAMES_BY_CODE;
    private static final Map<String, String> CODES_BY_KEY;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("05", "Antioquia");
        m.put("08", "Atlántico");
        m.put("11", "Bogotá D.C.");
        m.put("13", "Bolívar");
        m.put("15", "Boyacá");
        m.put("17", "Caldas");
        m.put("18", "Caquetá");
        m.put("19", "Cauca");
        m.put("20", "Cesar");
        m.put("23", "Córdoba");
        m.put("25", "Cundinamarca");
        m.put("27", "Chocó");
        m.put("41", "Huila");
        m.put("44", "La Guajira");
        m.put("47", "Magdalena");
        m.put("50", "Meta");
        m.put("52", "Nariño");
        m.put("54", "Norte de Santander");
        m.put("63", "Quindío");
        m.put("66", "Risaralda");
        m.put("68", "Santander");
        m.put("70", "Sucre");
        m.put("73", "Tolima");
        m.put("76", "Valle del Cauca");
        m.put("81", "Arauca");
        m.put("85", "Casanare");
        m.put("86", "Putumayo");
        m.put("88", "San Andrés y Providencia");
        m.put("91", "Amazonas");
        m.put("94", "Guainía");
        m.put("95", "Guaviare");
        m.put("97", "Vaupés");
        m.put("99", "Vichada");
        NAMES_BY_CODE = Map.copyOf(m);

        Map<String, String> k = new LinkedHashMap<>();
        m.forEach((code, name) -> k.put(key(name), code));
        k.put("BOGOTA", "11");
        k.put("BOGOTA DC", "11");
        k.put("DISTRITO CAPITAL", "11");
        k.put("GUAJIRA", "44");
        k.put("VALLE", "76");
        k.put("SAN ANDRES", "88");
        k.put("ARCHIPIELAGO DE SAN ANDRES PROVIDENCIA Y SANTA CATALINA", "88");
        CODES_BY_KEY = Map.copyOf(k);
    }

    private static String key(String name) {
        String t = FieldNormalizer.stripAccents(FieldNormalizer.repairEncoding(name)).toUpperCase(Locale.ROOT);
        return t.replaceAll("[^A-Z0-9]+", " ").strip();
    }

    public static Optional<String> nameFor(String code) {
        String c = FieldNormalizer.clean(code);
        if (c.length() == 1) c = "0" + c;
        return Optional.ofNullable(NAMES_BY_CODE.get(c));
    }

    public static Optional<String> codeFor(String departmentName) {
        String k = key(departmentName);
        if (k.isEmpty()) return Optional.empty();
        String exact = CODES_BY_KEY.get(k);
        if (exact != null) return Optional.of(exact);
        if (k.length() >= 4) {
            for (Map.Entry<String, String> e : CODES_BY_KEY.entrySet()) {
                if (e.getKey().startsWith(k + " ") || k.startsWith(e.getKey() + " ")) {
                    return Optional.of(e.getValue());
                }
            }
        }
        return Optional.empty();
    }

    /** Department code from a 5-digit DIVIPOLA municipality code. */
    public static Optional<String> departmentOfMunicipality(String municipalityCode) {
        String c = FieldNormalizer.clean(municipalityCode);
        if (c.length() == 4 && c.chars().allMatch(Character::isDigit)) c = "0" + c;
        if (c.length() >= 5 && c.chars().allMatch(Character::isDigit) && NAMES_BY_CODE.containsKey(c.substring(0, 2))) {
            return Optional.of(c.substring(0, 2));
        }
        return Optional.empty();
    }

    public static int size() {
        return NAMES_BY_CODE.size();
    }
}
