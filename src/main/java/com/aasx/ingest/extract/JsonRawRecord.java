package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record read from the JSON metadata generation ({@code assetAdministrationShells} / {@code submodels}).
 */
public record JsonRawRecord(
        ElementType elementType,
        String sourceFile,
        int position,
        Optional<String> identity,
        Optional<String> shortName,
        LocalizedText description,
        Optional<String> kind,
        List<String> submodelRefs
) implements RawRecord {

    public JsonRawRecord {
        Objects.requireNonNull(elementType, "elementType is required");
        Objects.requireNonNull(sourceFile, "sourceFile is required");
        identity = identity != null ? identity : Optional.empty();
        shortName = shortName != null ? shortName : Optional.empty();
        description = description != null ? description : LocalizedText.absent();
        kind = kind != null ? kind : Optional.empty();
        submodelRefs = submodelRefs != null ? List.copyOf(submodelRefs) : List.of();
    }

    @Override
    public OriginFormat originFormat() {
        return OriginFormat.JSON_V3;
    }
}
