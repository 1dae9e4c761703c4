package com.aasx.ingest.core.model;

/**
 * Completeness grade of an entity's expected fields
 * (identity, short name, description, kind).
 */
public enum QualityLevel {
    HIGH,
    MEDIUM,
    LOW;

    /**
     * Grades a count of non-empty expected fields out of four.
     */
    public static QualityLevel forPresentFields(int presentFields) {
        if (presentFields >= 4) {
            return HIGH;
        }
        if (presentFields >= 2) {
            return MEDIUM;
        }
        return LOW;
    }
}
