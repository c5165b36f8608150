package com.saludsync.reps.util;

import com.saludsync.reps.model.CapacityGroup;
import com.saludsync.reps.model.ComplexityLevel;
import com.saludsync.reps.model.HabilitationStatus;
import com.saludsync.reps.model.OperationalStatus;
import com.saludsync.reps.model.ServiceStatus;
import com.saludsync.reps.model.SiteType;
import com.saludsync.reps.model.YesNo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.Normalizer;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cell-level cleaning for REPS exports. All methods are null-safe and never throw on bad input.
 */
public final class FieldNormalizer {

    private FieldNormalizer() {}

    private static final Set<String> SENTINELS = Set.of("nan", "none", "null", "nat", "<na>");

    private static final int MAX_REPAIR_PASSES = 3;

    // Order matters: three-char sequences before their two-char prefixes.
    private static final List<Map.Entry<String, String>> MOJIBAKE = List.of(
            Map.entry("â€œ", "\""),   // left double quote
            Map.entry("â€\u009d", "\""),   // right double quote (latin-1 view)
            Map.entry("â€™", "'"),    // right single quote
            Map.entry("â€˜", "'"),    // left single quote
            Map.entry("â€“", "-"),    // en dash
            Map.entry("â€”", "-"),    // em dash
            Map.entry("â€\"", "-"),        // em dash after quote folding
            Map.entry("â€¦", "..."),  // ellipsis
            Map.entry("â€", "\""),         // dangling right quote
            Map.entry("Ãƒ", "Ã"),     // double-encoded lead byte
            Map.entry("Ã¡", "á"),
            Map.entry("Ã©", "é"),
            Map.entry("Ã\u00ad", "í"),
            Map.entry("Ã³", "ó"),
            Map.entry("Ãº", "ú"),
            Map.entry("Ã±", "ñ"),
            Map.entry("Ã¼", "ü"),
            Map.entry("Ã\u0081", "Á"),
            Map.entry("Ã‰", "É"),
            Map.entry("Ã\u0089", "É"),
            Map.entry("Ã\u008d", "Í"),
            Map.entry("Ã“", "Ó"),
            Map.entry("Ã\u0093", "Ó"),
            Map.entry("Ãš", "Ú"),
            Map.entry("Ã\u009a", "Ú"),
            Map.entry("Ã‘", "Ñ"),
            Map.entry("Ã\u0091", "Ñ"),
            Map.entry("Ãœ", "Ü"),
            Map.entry("Ã\u009c", "Ü"),
            Map.entry("Â\u00a0", " "),
            Map.entry("Â ", " "),
            Map.entry("Â°", "°"),
            Map.entry("Âº", "º"),
            Map.entry("Âª", "ª"),
            Map.entry("Â¿", "¿"),
            Map.entry("Â¡", "¡"),
            Map.entry("Â©", "©"),
            Map.entry("Â³", "³"),
            Map.entry("Â±", "±"),
            Map.entry("Â\u00ad", "\u00ad")
    );

    private static final Set<String> YES_WORDS = Set.of("SI", "YES", "Y", "S", "1", "TRUE", "X", "VERDADERO");
    private static final Set<String> NO_WORDS = Set.of("NO", "N", "0", "FALSE", "FALSO");

    private static final Map<ComplexityLevel, Set<String>> COMPLEXITY_EXACT = Map.of(
            ComplexityLevel.LOW, Set.of("BAJA", "BAJO", "LOW", "B"),
            ComplexityLevel.MEDIUM, Set.of("MEDIA", "MEDIO", "MEDIANA", "MEDIUM", "MED", "M"),
            ComplexityLevel.HIGH, Set.of("ALTA", "ALTO", "HIGH", "A")
    );

    // contains-match fallback, checked in this order
    private static final List<Map.Entry<String, ComplexityLevel>> COMPLEXITY_CONTAINS = List.of(
            Map.entry("BAJ", ComplexityLevel.LOW),
            Map.entry("LOW", ComplexityLevel.LOW),
            Map.entry("MEDI", ComplexityLevel.MEDIUM),
            Map.entry("ALT", ComplexityLevel.HIGH),
            Map.entry("HIGH", ComplexityLevel.HIGH)
    );

    private static final Map<String, SiteType> SITE_TYPES = Map.ofEntries(
            Map.entry("PRINCIPAL", SiteType.PRINCIPAL),
            Map.entry("SEDE PRINCIPAL", SiteType.PRINCIPAL),
            Map.entry("HOSPITALARIA", SiteType.PRINCIPAL),
            Map.entry("SUCURSAL", SiteType.SATELLITE),
            Map.entry("SATELITE", SiteType.SATELLITE),
            Map.entry("SATELLITE", SiteType.SATELLITE),
            Map.entry("AMBULATORIA", SiteType.SATELLITE),
            Map.entry("ADMINISTRATIVA", SiteType.SATELLITE),
            Map.entry("DIAGNOSTICO", SiteType.SATELLITE),
            Map.entry("URGENCIAS", SiteType.SATELLITE),
            Map.entry("MOVIL", SiteType.MOBILE),
            Map.entry("UNIDAD MOVIL", SiteType.MOBILE),
            Map.entry("MOBILE", SiteType.MOBILE),
            Map.entry("DOMICILIARIA", SiteType.DOMICILIARY),
            Map.entry("DOMICILIARIO", SiteType.DOMICILIARY),
            Map.entry("TELEMEDICINA", SiteType.TELEMEDICINE),
            Map.entry("TELEMEDICINE", SiteType.TELEMEDICINE)
    );

    private static final Set<String> AMBULANCE_MODALITIES = Set.of("TAB", "TAM", "TAAV", "UAT");

    private static final Map<String, ServiceStatus> SERVICE_STATUSES = Map.of(
            "HABILITADO", ServiceStatus.ACTIVE,
            "ACTIVO", ServiceStatus.ACTIVE,
            "SI", ServiceStatus.ACTIVE,
            "SUSPENDIDO", ServiceStatus.SUSPENDED,
            "CANCELADO", ServiceStatus.CANCELLED,
            "VENCIDO", ServiceStatus.EXPIRED
    );

    private static final Map<String, HabilitationStatus> HABILITATION_STATUSES = Map.ofEntries(
            Map.entry("SI", HabilitationStatus.ENABLED),
            Map.entry("HABILITADA", HabilitationStatus.ENABLED),
            Map.entry("HABILITADO", HabilitationStatus.ENABLED),
            Map.entry("ACTIVA", HabilitationStatus.ENABLED),
            Map.entry("ACTIVO", HabilitationStatus.ENABLED),
            Map.entry("EN PROCESO", HabilitationStatus.IN_PROGRESS),
            Map.entry("SUSPENDIDA", HabilitationStatus.SUSPENDED),
            Map.entry("SUSPENDIDO", HabilitationStatus.SUSPENDED),
            Map.entry("CANCELADA", HabilitationStatus.CANCELLED),
            Map.entry("CANCELADO", HabilitationStatus.CANCELLED),
            Map.entry("CERRADA", HabilitationStatus.CANCELLED),
            Map.entry("VENCIDA", HabilitationStatus.EXPIRED),
            Map.entry("VENCIDO", HabilitationStatus.EXPIRED)
    );

    private static final Map<HabilitationStatus, OperationalStatus> OPERATIONAL_BY_HABILITATION = Map.of(
            HabilitationStatus.ENABLED, OperationalStatus.ACTIVE,
            HabilitationStatus.IN_PROGRESS, OperationalStatus.UNDER_CONSTRUCTION,
            HabilitationStatus.SUSPENDED, OperationalStatus.TEMPORARILY_CLOSED,
            HabilitationStatus.CANCELLED, OperationalStatus.PERMANENTLY_CLOSED,
            HabilitationStatus.EXPIRED, OperationalStatus.INACTIVE
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu/M/d").withResolverStyle(ResolverStyle.STRICT)
    );

    private static final Pattern TIME_SUFFIX = Pattern.compile("[T ]\\d{1,2}:\\d{2}.*$");
    private static final Pattern PHONE_JUNK = Pattern.compile("[^0-9+\\-() ]");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    public static String clean(String value) {
        if (value == null) return "";
        String t = value.replace('\u00a0', ' ').strip();
        if (SENTINELS.contains(t.toLowerCase(Locale.ROOT))) return "";
        return t;
    }

    /**
     * Undo UTF-8 text that was decoded as Latin-1/Windows-1252 somewhere upstream.
     * Runs the replacement table until the text stops changing (double-encoded cells need two passes).
     */
    public static String repairEncoding(String value) {
        String current = clean(value);
        if (current.isEmpty()) return current;
        for (int pass = 0; pass < MAX_REPAIR_PASSES; pass++) {
            String next = applyMojibakeTable(current);
            if (next.equals(current)) break;
            current = next;
        }
        return current.strip();
    }

    private static String applyMojibakeTable(String s) {
        String out = s;
        for (Map.Entry<String, String> e : MOJIBAKE) {
            if (out.contains(e.getKey())) {
                out = out.replace(e.getKey(), e.getValue());
            }
        }
        return out;
    }

    public static String stripAccents(String value) {
        if (value == null) return "";
        return DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
    }

    // upper-case, accent-free, single-spaced
    private static String token(String value) {
        return stripAccents(repairEncoding(value)).toUpperCase(Locale.ROOT).replace('_', ' ').replaceAll("\\s+", " ");
    }

    /** Canonical key for a column header: lower-case, accent-free, words joined by underscores. */
    public static String headerKey(String header) {
        String t = stripAccents(repairEncoding(header)).toLowerCase(Locale.ROOT);
        return t.replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    public static YesNo yesNo(String value) {
        String t = token(value);
        if (t.isEmpty()) return YesNo.UNKNOWN;
        if (YES_WORDS.contains(t)) return YesNo.YES;
        if (NO_WORDS.contains(t)) return YesNo.NO;
        return YesNo.UNKNOWN;
    }

    public static Optional<ComplexityLevel> complexity(String value) {
        String t = token(value);
        if (t.isEmpty()) return Optional.empty();
        for (Map.Entry<ComplexityLevel, Set<String>> e : COMPLEXITY_EXACT.entrySet()) {
            if (e.getValue().contains(t)) return Optional.of(e.getKey());
        }
        for (Map.Entry<String, ComplexityLevel> e : COMPLEXITY_CONTAINS) {
            if (t.contains(e.getKey())) return Optional.of(e.getValue());
        }
        return Optional.empty();
    }

    public static Optional<SiteType> explicitSiteType(String value) {
        String t = token(value);
        if (t.startsWith("SEDE ") && !SITE_TYPES.containsKey(t)) t = t.substring(5);
        return Optional.ofNullable(SITE_TYPES.get(t));
    }

    /** REPS capacity group by its plural label, its singular, or the first word of a longer label. */
    public static Optional<CapacityGroup> capacityGroup(String value) {
        String t = token(value);
        if (t.isEmpty()) return Optional.empty();
        Optional<CapacityGroup> exact = groupByLabel(t);
        if (exact.isPresent()) return exact;
        int space = t.indexOf(' ');
        return space > 0 ? groupByLabel(t.substring(0, space)) : Optional.empty();
    }

    private static Optional<CapacityGroup> groupByLabel(String t) {
        for (CapacityGroup g : CapacityGroup.values()) {
            String label = g.getRepsLabel();
            if (t.equals(label) || t.equals(label.substring(0, label.length() - 1))) return Optional.of(g);
        }
        return Optional.empty();
    }

    public static Optional<String> ambulanceModality(String value) {
        String t = token(value);
        return AMBULANCE_MODALITIES.contains(t) ? Optional.of(t) : Optional.empty();
    }

    public static ServiceStatus serviceStatus(String value) {
        return SERVICE_STATUSES.getOrDefault(token(value), ServiceStatus.ACTIVE);
    }

    public static HabilitationStatus habilitationStatus(String value) {
        return HABILITATION_STATUSES.getOrDefault(token(value), HabilitationStatus.ENABLED);
    }

    public static OperationalStatus operationalStatus(HabilitationStatus habilitationStatus) {
        if (habilitationStatus == null) return OperationalStatus.ACTIVE;
        return OPERATIONAL_BY_HABILITATION.getOrDefault(habilitationStatus, OperationalStatus.ACTIVE);
    }

    public static Optional<LocalDate> parseDate(String value) {
        String t = clean(value);
        if (t.isEmpty()) return Optional.empty();
        t = TIME_SUFFIX.matcher(t).replaceFirst("");
        for (DateTimeFormatter f : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(t, f));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    public static int parseInt(String value, int defaultValue) {
        String t = clean(value);
        if (t.isEmpty()) return defaultValue;
        try {
            return new BigDecimal(t).setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return defaultValue;
        }
    }

    /** Site numbers come through spreadsheets as "1.0" as often as "1". */
    public static String siteNumber(String value) {
        String t = clean(value);
        if (t.endsWith(".0")) t = t.substring(0, t.length() - 2);
        return t;
    }

    public static String cleanPhone(String value) {
        String t = PHONE_JUNK.matcher(repairEncoding(value)).replaceAll(" ").replaceAll("\\s+", " ").strip();
        long digits = t.chars().filter(Character::isDigit).count();
        return digits >= 7 ? t : "";
    }

    public static String cleanEmail(String value) {
        String t = clean(value).toLowerCase(Locale.ROOT);
        for (String candidate : t.split("[;,\\s]+")) {
            if (EMAIL.matcher(candidate).matches()) return candidate;
        }
        return "";
    }
}
