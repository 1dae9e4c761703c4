package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record read from the legacy namespaced XML generation. Shells may carry an
 * {@code assetRef} pointing at the asset they describe.
 */
public record XmlRawRecord(
        ElementType elementType,
        String sourceFile,
        int position,
        Optional<String> identity,
        Optional<String> shortName,
        LocalizedText description,
        Optional<String> kind,
        List<String> submodelRefs,
        Optional<String> assetRef
) implements RawRecord {

    public XmlRawRecord {
        Objects.requireNonNull(elementType, "elementType is required");
        Objects.requireNonNull(sourceFile, "sourceFile is required");
        identity = identity != null ? identity : Optional.empty();
        shortName = shortName != null ? shortName : Optional.empty();
        description = description != null ? description : LocalizedText.absent();
        kind = kind != null ? kind : Optional.empty();
        submodelRefs = submodelRefs != null ? List.copyOf(submodelRefs) : List.of();
        assetRef = assetRef != null ? assetRef : Optional.empty();
    }

    @Override
    public OriginFormat originFormat() {
        return OriginFormat.XML_V1;
    }
}
