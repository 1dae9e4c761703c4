package com.aasx.ingest.normalize;

import com.aasx.ingest.core.model.ElementType;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Derives keys for records that carry no identity. The key is a name-based UUID over
 * container, entry, element type, short name (or element type label) and position,
 * so the same unchanged container always yields the same keys.
 */
public final class SyntheticKeyGenerator {

    public static final String PREFIX = "synthetic:";

    private SyntheticKeyGenerator() {
    }

    public static String generate(String container, String sourceFile, ElementType elementType,
                                  String shortName, int position) {
        String name = shortName == null || shortName.isBlank() ? elementType.getLabel() : shortName;
        String seed = String.join("|",
                container == null ? "" : container,
                sourceFile,
                elementType.name(),
                name,
                Integer.toString(position));
        return PREFIX + UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isSynthetic(String key) {
        return key != null && key.startsWith(PREFIX);
    }
}
