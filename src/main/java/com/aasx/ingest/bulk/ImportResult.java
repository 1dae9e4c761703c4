package com.aasx.ingest.bulk;

/**
 * Outcome of importing one batch. In a dry run only the planned counts are set.
 *
 * @param sourceFile    batch file name, or batch name when imported from memory
 * @param dryRun        whether the store was left untouched
 * @param nodesPlanned  nodes in the batch
 * @param edgesPlanned  edges in the batch
 * @param nodesCreated  nodes that did not exist before
 * @param nodesUpdated  existing nodes whose properties were overwritten
 * @param edgesCreated  edges that did not exist before
 * @param edgesUpdated  existing edges whose properties were overwritten
 * @param edgesSkipped  edges with an endpoint missing from both batch and store
 */
public record ImportResult(
        String sourceFile,
        boolean dryRun,
        int nodesPlanned,
        int edgesPlanned,
        int nodesCreated,
        int nodesUpdated,
        int edgesCreated,
        int edgesUpdated,
        int edgesSkipped
) {

    public static ImportResult planned(String sourceFile, int nodes, int edges) {
        return new ImportResult(sourceFile, true, nodes, edges, 0, 0, 0, 0, 0);
    }

    public int nodesWritten() {
        return nodesCreated + nodesUpdated;
    }

    public int edgesWritten() {
        return edgesCreated + edgesUpdated;
    }

    @Override
    public String toString() {
        if (dryRun) {
            return "ImportResult{source=" + sourceFile + ", dryRun, nodes=" + nodesPlanned + ", edges=" + edgesPlanned + '}';
        }
        return "ImportResult{source=" + sourceFile +
                ", nodesCreated=" + nodesCreated +
                ", nodesUpdated=" + nodesUpdated +
                ", edgesCreated=" + edgesCreated +
                ", edgesUpdated=" + edgesUpdated +
                ", edgesSkipped=" + edgesSkipped + '}';
    }
}
