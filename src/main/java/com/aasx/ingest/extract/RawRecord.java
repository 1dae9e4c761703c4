package com.aasx.ingest.extract;

import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.OriginFormat;

import java.util.List;
import java.util.Optional;

/**
 * Schema-specific view of one shell, asset or submodel before normalization.
 * Each origin format has its own variant so field presence is explicit per schema.
 */
public sealed interface RawRecord permits JsonRawRecord, XmlRawRecord {

    ElementType elementType();

    /** Entry name the record was read from. */
    String sourceFile();

    /** Zero-based position of the record among records of the same element type in its entry. */
    int position();

    OriginFormat originFormat();

    Optional<String> identity();

    Optional<String> shortName();

    LocalizedText description();

    Optional<String> kind();

    List<String> submodelRefs();
}
