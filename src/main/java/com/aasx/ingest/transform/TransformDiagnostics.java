package com.aasx.ingest.transform;

import java.util.List;

/**
 * What the transformer dropped.
 *
 * @param danglingReferences references whose target is not a node of the batch
 * @param danglingDetails    one {@code from -TYPE-> to} line per dropped reference
 * @param duplicateEntities  entities whose id was already taken by an earlier entity
 */
public record TransformDiagnostics(int danglingReferences, List<String> danglingDetails, int duplicateEntities) {

    public TransformDiagnostics {
        danglingDetails = danglingDetails != null ? List.copyOf(danglingDetails) : List.of();
    }

    public static TransformDiagnostics none() {
        return new TransformDiagnostics(0, List.of(), 0);
    }
}
