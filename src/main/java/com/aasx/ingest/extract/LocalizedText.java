package com.aasx.ingest.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A description as it appears in metadata: a bare string, a language-tagged map,
 * or nothing at all. Map iteration order is the order of appearance in the source.
 */
public final class LocalizedText {

    private static final LocalizedText ABSENT = new LocalizedText(null, Map.of());

    private final String plain;
    private final Map<String, String> byLanguage;

    private LocalizedText(String plain, Map<String, String> byLanguage) {
        this.plain = plain;
        this.byLanguage = byLanguage;
    }

    public static LocalizedText plain(String text) {
        Objects.requireNonNull(text, "text is required");
        return new LocalizedText(text, Map.of());
    }

    public static LocalizedText of(Map<String, String> byLanguage) {
        Objects.requireNonNull(byLanguage, "byLanguage is required");
        if (byLanguage.isEmpty()) {
            return ABSENT;
        }
        return new LocalizedText(null, Collections.unmodifiableMap(new LinkedHashMap<>(byLanguage)));
    }

    public static LocalizedText absent() {
        return ABSENT;
    }

    public boolean isPlain() {
        return plain != null;
    }

    public boolean isAbsent() {
        return plain == null && byLanguage.isEmpty();
    }

    public String plainText() {
        return plain;
    }

    public Map<String, String> byLanguage() {
        return byLanguage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocalizedText that)) return false;
        return Objects.equals(plain, that.plain) && byLanguage.equals(that.byLanguage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(plain, byLanguage);
    }

    @Override
    public String toString() {
        if (isPlain()) {
            return "LocalizedText{'" + plain + "'}";
        }
        return isAbsent() ? "LocalizedText{absent}" : "LocalizedText" + byLanguage;
    }
}
