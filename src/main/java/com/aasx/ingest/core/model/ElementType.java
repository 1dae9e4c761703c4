package com.aasx.ingest.core.model;

/**
 * Kind of metadata element an {@link Entity} was extracted from.
 * The label doubles as the graph node label.
 */
public enum ElementType {
    SHELL("Shell", true),
    ASSET("Asset", true),
    SUBMODEL("Submodel", false);

    private final String label;
    private final boolean assetGroup;

    ElementType(String label, boolean assetGroup) {
        this.label = label;
        this.assetGroup = assetGroup;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Shells and assets are reported together under {@code assets[]} in the extraction output.
     */
    public boolean isAssetGroup() {
        return assetGroup;
    }

    public static ElementType fromLabel(String label) {
        for (ElementType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown element label: " + label);
    }
}
