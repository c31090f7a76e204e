package dev.mispesos.records;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonicalises free-text enum values: trims, lower-cases and strips diacritics so that
 * {@code "Educación"}, {@code "educacion"} and {@code " EDUCACION "} resolve identically.
 */
public final class ValueAliases {

    private ValueAliases() {
        // Utility class
    }

    public static String canonical(String raw) {
        if (raw == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(raw.trim(), Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT);
    }
}
