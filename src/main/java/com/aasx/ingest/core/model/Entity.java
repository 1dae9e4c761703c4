package com.aasx.ingest.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical record of one shell, asset or submodel after normalization.
 * Immutable; every text field is non-null (empty when absent in the source).
 *
 * <p>{@link #getKey()} is the natural identity when the source carried one, otherwise
 * a synthetic key that is stable across runs over the same container.</p>
 */
public final class Entity {
    private final String key;
    private final String identity;
    private final String shortName;
    private final String description;
    private final String kind;
    private final ElementType elementType;
    private final String sourceFile;
    private final String container;
    private final OriginFormat originFormat;
    private final List<String> submodelRefs;
    private final String assetRef;

    private Entity(Builder builder) {
        this.identity = nullToEmpty(builder.identity);
        this.key = builder.key != null && !builder.key.isBlank() ? builder.key : this.identity;
        this.shortName = nullToEmpty(builder.shortName);
        this.description = nullToEmpty(builder.description);
        this.kind = nullToEmpty(builder.kind);
        this.elementType = builder.elementType;
        this.sourceFile = builder.sourceFile;
        this.container = nullToEmpty(builder.container);
        this.originFormat = builder.originFormat;
        this.submodelRefs = builder.submodelRefs != null ? List.copyOf(builder.submodelRefs) : List.of();
        this.assetRef = nullToEmpty(builder.assetRef);
    }

    public String getKey() {
        return key;
    }

    public String getIdentity() {
        return identity;
    }

    public boolean hasNaturalIdentity() {
        return !identity.isEmpty();
    }

    public String getShortName() {
        return shortName;
    }

    public String getDescription() {
        return description;
    }

    public String getKind() {
        return kind;
    }

    public ElementType getElementType() {
        return elementType;
    }

    /**
     * Name of the container entry this entity was read from.
     */
    public String getSourceFile() {
        return sourceFile;
    }

    /**
     * File name of the container holding {@link #getSourceFile()}.
     */
    public String getContainer() {
        return container;
    }

    public OriginFormat getOriginFormat() {
        return originFormat;
    }

    /**
     * Identities of submodels a shell references; empty for other element types.
     */
    public List<String> getSubmodelRefs() {
        return submodelRefs;
    }

    /**
     * Identity of the asset a legacy shell points at, or empty.
     */
    public String getAssetRef() {
        return assetRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(key, entity.key)
                && elementType == entity.elementType
                && Objects.equals(sourceFile, entity.sourceFile)
                && Objects.equals(container, entity.container);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, elementType, sourceFile, container);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "key='" + key + '\'' +
                ", shortName='" + shortName + '\'' +
                ", elementType=" + elementType +
                ", sourceFile='" + sourceFile + '\'' +
                ", originFormat=" + originFormat +
                '}';
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String key;
        private String identity;
        private String shortName;
        private String description;
        private String kind;
        private ElementType elementType;
        private String sourceFile;
        private String container;
        private OriginFormat originFormat;
        private List<String> submodelRefs;
        private String assetRef;

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        public Builder shortName(String shortName) {
            this.shortName = shortName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder elementType(ElementType elementType) {
            this.elementType = elementType;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder container(String container) {
            this.container = container;
            return this;
        }

        public Builder originFormat(OriginFormat originFormat) {
            this.originFormat = originFormat;
            return this;
        }

        public Builder submodelRefs(List<String> submodelRefs) {
            this.submodelRefs = submodelRefs;
            return this;
        }

        public Builder assetRef(String assetRef) {
            this.assetRef = assetRef;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(elementType, "elementType is required");
            Objects.requireNonNull(sourceFile, "sourceFile is required");
            Objects.requireNonNull(originFormat, "originFormat is required");
            if ((key == null || key.isBlank()) && (identity == null || identity.isBlank())) {
                throw new IllegalStateException("Either identity or a synthetic key is required");
            }
            return new Entity(this);
        }
    }
}
