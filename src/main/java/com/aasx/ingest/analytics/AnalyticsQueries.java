package com.aasx.ingest.analytics;

/**
 * Read-only Cypher used by {@link GraphAnalytics}.
 */
public final class AnalyticsQueries {

    private AnalyticsQueries() {
    }

    public static final String NODE_COUNT = """
            MATCH (n:AasNode)
            RETURN count(n) AS totalNodes
            """;

    public static final String EDGE_COUNT = """
            MATCH (:AasNode)-[r]->(:AasNode)
            RETURN count(r) AS totalEdges
            """;

    public static final String ENTITY_TYPE_DISTRIBUTION = """
            MATCH (n:AasNode)
            RETURN n.elementType AS elementType, count(n) AS count
            ORDER BY count DESC, elementType
            """;

    public static final String RELATIONSHIP_TYPE_DISTRIBUTION = """
            MATCH (:AasNode)-[r]->(:AasNode)
            RETURN type(r) AS relationshipType, count(r) AS count
            ORDER BY count DESC, relationshipType
            """;

    public static final String QUALITY_DISTRIBUTION = """
            MATCH (n:AasNode)
            WHERE n.qualityLevel IS NOT NULL
            RETURN n.elementType AS elementType, n.qualityLevel AS qualityLevel, count(n) AS count
            ORDER BY elementType, qualityLevel
            """;

    public static final String COMPLIANCE_SUMMARY = """
            MATCH (n:AasNode)
            WHERE n.complianceStatus IS NOT NULL
            RETURN n.elementType AS elementType, n.complianceStatus AS status, count(n) AS count
            ORDER BY elementType, status
            """;

    public static final String RELATIONSHIP_PATTERNS = """
            MATCH (a:AasNode)-[r]->(b:AasNode)
            RETURN a.elementType AS fromType, type(r) AS relationshipType, b.elementType AS toType, count(r) AS count
            ORDER BY count DESC
            """;

    public static final String ISOLATED_NODES = """
            MATCH (n:AasNode)
            OPTIONAL MATCH (n)-[r]-()
            WITH n, count(r) AS degree
            WHERE degree = 0
            RETURN n.id AS id, n.elementType AS elementType, n.shortName AS shortName
            ORDER BY elementType, shortName
            """;

    public static final String SHELLS_WITH_MOST_SUBMODELS = """
            MATCH (s:Shell)-[:HAS_SUBMODEL]->(m:Submodel)
            RETURN s.id AS shellId, s.shortName AS shortName, count(m) AS submodelCount
            ORDER BY submodelCount DESC, shellId
            LIMIT $limit
            """;

    /**
     * Template: the hop bound is formatted in as {@code %d} since Cypher does not
     * accept parameters in variable-length patterns.
     */
    public static final String RELATED_ENTITIES = """
            MATCH p = (start:AasNode {id: $id})-[*1..%d]-(related:AasNode)
            WHERE related.id <> start.id
            RETURN related.id AS id, related.elementType AS elementType, related.shortName AS shortName,
                   min(length(p)) AS distance
            ORDER BY distance, id
            """;

    public static final String SEARCH_ENTITIES = """
            MATCH (n:AasNode)
            WHERE toLower(n.shortName) CONTAINS toLower($term)
               OR toLower(n.description) CONTAINS toLower($term)
               OR toLower(n.identity) CONTAINS toLower($term)
            RETURN n.id AS id, n.elementType AS elementType, n.shortName AS shortName, n.description AS description
            ORDER BY elementType, shortName
            LIMIT $limit
            """;

    public static final String SEARCH_ENTITIES_BY_TYPE = """
            MATCH (n:AasNode)
            WHERE n.elementType = $elementType
              AND (toLower(n.shortName) CONTAINS toLower($term)
                   OR toLower(n.description) CONTAINS toLower($term)
                   OR toLower(n.identity) CONTAINS toLower($term))
            RETURN n.id AS id, n.elementType AS elementType, n.shortName AS shortName, n.description AS description
            ORDER BY shortName
            LIMIT $limit
            """;

    public static final String SHORTEST_PATH = """
            MATCH (a:AasNode {id: $fromId}), (b:AasNode {id: $toId})
            WITH shortestPath((a)-[*1..%d]-(b)) AS p
            WHERE p IS NOT NULL
            RETURN length(p) AS pathLength, [n IN nodes(p) | n.id] AS nodeIds
            """;

    public static final String ENTITIES_BY_QUALITY = """
            MATCH (n:AasNode)
            WHERE n.qualityLevel = $qualityLevel
            RETURN n.id AS id, n.elementType AS elementType, n.shortName AS shortName
            ORDER BY elementType, shortName
            """;

    public static final String ENTITIES_BY_COMPLIANCE = """
            MATCH (n:AasNode)
            WHERE n.complianceStatus = $status
            RETURN n.id AS id, n.elementType AS elementType, n.shortName AS shortName
            ORDER BY elementType, shortName
            """;
}
