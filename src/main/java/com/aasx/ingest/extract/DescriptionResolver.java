package com.aasx.ingest.extract;

import java.util.Map;

/**
 * Picks one human-readable string out of a {@link LocalizedText}.
 *
 * <p>Bare strings are returned unchanged. For language maps the English entry wins
 * ({@code en}, case-insensitive); otherwise the first entry in source order. Absent
 * text resolves to the empty string.</p>
 */
public final class DescriptionResolver {

    public static final String PREFERRED_LANGUAGE = "en";

    private DescriptionResolver() {
    }

    public static String resolve(LocalizedText text) {
        if (text == null || text.isAbsent()) {
            return "";
        }
        if (text.isPlain()) {
            return text.plainText();
        }
        String first = null;
        for (Map.Entry<String, String> entry : text.byLanguage().entrySet()) {
            if (PREFERRED_LANGUAGE.equalsIgnoreCase(entry.getKey())) {
                return nullToEmpty(entry.getValue());
            }
            if (first == null) {
                first = entry.getValue();
            }
        }
        return nullToEmpty(first);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
