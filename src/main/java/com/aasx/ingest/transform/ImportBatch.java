package com.aasx.ingest.transform;

import com.aasx.ingest.core.model.DocumentRef;

import java.util.List;
import java.util.Objects;

/**
 * Named set of nodes and edges imported as one unit.
 */
public record ImportBatch(
        String name,
        List<GraphNode> nodes,
        List<GraphEdge> edges,
        List<DocumentRef> documents,
        TransformDiagnostics diagnostics
) {

    public ImportBatch {
        Objects.requireNonNull(name, "name is required");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        documents = documents != null ? List.copyOf(documents) : List.of();
        diagnostics = diagnostics != null ? diagnostics : TransformDiagnostics.none();
    }

    @Override
    public String toString() {
        return "ImportBatch{name=%s, nodes=%d, edges=%d, dangling=%d}"
                .formatted(name, nodes.size(), edges.size(), diagnostics.danglingReferences());
    }
}
