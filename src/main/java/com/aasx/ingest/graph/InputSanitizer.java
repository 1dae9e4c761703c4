package com.aasx.ingest.graph;

import java.util.regex.Pattern;

/**
 * Validation of values that end up in Cypher text: labels, relationship types and
 * property keys are interpolated, so they must be plain identifiers.
 */
public final class InputSanitizer {

    public static final int MAX_NODE_ID_LENGTH = 2048;
    public static final int MAX_CYPHER_VALUE_LENGTH = 65536;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private InputSanitizer() {
    }

    public static void validateLabel(String label) {
        requireIdentifier(label, "Label");
    }

    public static void validateRelationshipType(String relationshipType) {
        requireIdentifier(relationshipType, "Relationship type");
    }

    public static void validatePropertyKey(String key) {
        requireIdentifier(key, "Property key");
    }

    public static void validateNodeId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id must not be null or blank");
        }
        if (id.length() > MAX_NODE_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "Node id exceeds maximum length of " + MAX_NODE_ID_LENGTH + " characters (was " + id.length() + ")");
        }
        if (containsControlCharacters(id)) {
            throw new IllegalArgumentException("Node id must not contain control characters");
        }
    }

    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }

    private static void requireIdentifier(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be null or blank");
        }
        if (!IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(
                    what + " must start with a letter or underscore and contain only letters, digits and underscores, got: '"
                            + value + "'");
        }
    }

    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
