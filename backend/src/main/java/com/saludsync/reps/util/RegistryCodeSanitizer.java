package com.saludsync.reps.util;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Natural-key helpers for facility registry codes ({@code <provider code>_<site number>}).
 */
public final class RegistryCodeSanitizer {

    private RegistryCodeSanitizer() {}

    public static final int MAX_LENGTH = 20;

    private static final Pattern UUID_SUFFIX = Pattern.compile(
            "[_\\-]?[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Pattern INVALID_CHAR = Pattern.compile("[^A-Za-z0-9_]");
    private static final Set<String> EMPTY_MARKERS = Set.of("nan", "null", "none");

    public static String naturalKey(String providerCode, String siteNumber) {
        return sanitize(providerCode) + "_" + sanitize(FieldNormalizer.siteNumber(siteNumber));
    }

    public static String sanitize(String code) {
        if (code == null) return "";
        String t = code.strip();
        if (EMPTY_MARKERS.contains(t.toLowerCase(Locale.ROOT))) return "";
        return INVALID_CHAR.matcher(t).replaceAll("");
    }

    public static boolean hasUuidSuffix(String code) {
        return code != null && UUID_SUFFIX.matcher(code).find();
    }

    /** Removes a trailing UUID left by older imports, then the separator debris around it. */
    public static String stripUuidSuffix(String code) {
        if (code == null) return "";
        String t = UUID_SUFFIX.matcher(code.strip()).replaceAll("");
        return t.replaceAll("[_\\-. ]+$", "");
    }

    public static boolean hasWhitespaceIssue(String code) {
        return code != null && code.chars().anyMatch(Character::isWhitespace);
    }

    public static boolean isValid(String code) {
        return code != null && !code.isEmpty() && code.length() <= MAX_LENGTH && VALID.matcher(code).matches();
    }

    public static String formatIssue(String code) {
        if (code == null || code.isEmpty()) return "Código vacío";
        if (code.length() > MAX_LENGTH) {
            return "Demasiado largo (" + code.length() + " caracteres, máximo " + MAX_LENGTH + ")";
        }
        if (!VALID.matcher(code).matches()) {
            Set<String> bad = new TreeSet<>();
            INVALID_CHAR.matcher(code).results().forEach(m -> bad.add(m.group()));
            return "Caracteres inválidos: " + bad;
        }
        return "Formato válido";
    }

    /** Best guess at the code an import originally meant to write. */
    public static String repair(String code) {
        return sanitize(stripUuidSuffix(code));
    }
}
