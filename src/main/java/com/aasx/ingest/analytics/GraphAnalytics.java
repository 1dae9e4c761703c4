package com.aasx.ingest.analytics;

import com.aasx.ingest.core.model.ComplianceStatus;
import com.aasx.ingest.core.model.ElementType;
import com.aasx.ingest.core.model.QualityLevel;
import com.aasx.ingest.graph.GraphConnection;
import com.aasx.ingest.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Read-only queries over the imported graph. Every failure, including a rejected
 * ad-hoc query, surfaces as {@link QueryExecutionException} with the query text.
 */
public class GraphAnalytics {
    private static final Logger log = LoggerFactory.getLogger(GraphAnalytics.class);

    public static final int MAX_HOPS = 10;
    public static final int DEFAULT_LIMIT = 50;

    private static final Pattern MUTATING = Pattern.compile(
            "\\b(CREATE|MERGE|DELETE|DETACH|SET|REMOVE|DROP|LOAD\\s+CSV|CALL)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^'\\\\]|\\\\.)*'|\"(?:[^\"\\\\]|\\\\.)*\"");

    private final GraphConnection connection;
    private final Clock clock;

    public GraphAnalytics(GraphConnection connection) {
        this(connection, Clock.systemUTC());
    }

    public GraphAnalytics(GraphConnection connection, Clock clock) {
        this.connection = connection;
        this.clock = clock;
    }

    public List<Map<String, Object>> qualityDistribution() {
        return run(AnalyticsQueries.QUALITY_DISTRIBUTION, Map.of());
    }

    /**
     * Quality distribution summed over element types. Levels with no nodes map to zero.
     */
    public Map<QualityLevel, Long> qualityCounts() {
        Map<QualityLevel, Long> counts = new EnumMap<>(QualityLevel.class);
        for (QualityLevel level : QualityLevel.values()) {
            counts.put(level, 0L);
        }
        for (Map<String, Object> row : qualityDistribution()) {
            parseEnum(QualityLevel.class, row.get("qualityLevel"))
                    .ifPresent(level -> counts.merge(level, toLong(row.get("count")), Long::sum));
        }
        return counts;
    }

    public List<Map<String, Object>> complianceSummary() {
        return run(AnalyticsQueries.COMPLIANCE_SUMMARY, Map.of());
    }

    public Map<ComplianceStatus, Long> complianceCounts() {
        Map<ComplianceStatus, Long> counts = new EnumMap<>(ComplianceStatus.class);
        for (ComplianceStatus status : ComplianceStatus.values()) {
            counts.put(status, 0L);
        }
        for (Map<String, Object> row : complianceSummary()) {
            parseEnum(ComplianceStatus.class, row.get("status"))
                    .ifPresent(status -> counts.merge(status, toLong(row.get("count")), Long::sum));
        }
        return counts;
    }

    public List<Map<String, Object>> entityTypeDistribution() {
        return run(AnalyticsQueries.ENTITY_TYPE_DISTRIBUTION, Map.of());
    }

    public List<Map<String, Object>> relationshipTypeDistribution() {
        return run(AnalyticsQueries.RELATIONSHIP_TYPE_DISTRIBUTION, Map.of());
    }

    public List<Map<String, Object>> relationshipPatterns() {
        return run(AnalyticsQueries.RELATIONSHIP_PATTERNS, Map.of());
    }

    public List<Map<String, Object>> isolatedNodes() {
        return run(AnalyticsQueries.ISOLATED_NODES, Map.of());
    }

    public List<Map<String, Object>> shellsWithMostSubmodels(int limit) {
        return run(AnalyticsQueries.SHELLS_WITH_MOST_SUBMODELS, Map.of("limit", requirePositive(limit, "limit")));
    }

    /**
     * Total node and edge counts as a single row.
     */
    public Map<String, Object> databaseSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("totalNodes", firstLong(run(AnalyticsQueries.NODE_COUNT, Map.of()), "totalNodes"));
        summary.put("totalEdges", firstLong(run(AnalyticsQueries.EDGE_COUNT, Map.of()), "totalEdges"));
        return summary;
    }

    /**
     * Entities reachable from {@code id} within {@code maxHops} relationships in either direction.
     *
     * @param maxHops 1 to {@value #MAX_HOPS}
     */
    public List<Map<String, Object>> relatedEntities(String id, int maxHops) {
        requireText(id, "id");
        String query = AnalyticsQueries.RELATED_ENTITIES.formatted(requireHops(maxHops));
        return run(query, Map.of("id", id));
    }

    public List<Map<String, Object>> searchEntities(String term, Optional<ElementType> elementType) {
        return searchEntities(term, elementType, DEFAULT_LIMIT);
    }

    /**
     * Case-insensitive substring search over short name, description and identity.
     */
    public List<Map<String, Object>> searchEntities(String term, Optional<ElementType> elementType, int limit) {
        requireText(term, "term");
        Map<String, Object> params = new HashMap<>();
        params.put("term", term);
        params.put("limit", requirePositive(limit, "limit"));
        if (elementType.isPresent()) {
            params.put("elementType", elementType.get().getLabel());
            return run(AnalyticsQueries.SEARCH_ENTITIES_BY_TYPE, params);
        }
        return run(AnalyticsQueries.SEARCH_ENTITIES, params);
    }

    /**
     * Shortest path between two entities, ignoring direction.
     *
     * @return path length and node ids, or empty when unconnected within {@value #MAX_HOPS} hops
     */
    public Optional<Map<String, Object>> shortestPath(String fromId, String toId) {
        requireText(fromId, "fromId");
        requireText(toId, "toId");
        List<Map<String, Object>> rows = run(AnalyticsQueries.SHORTEST_PATH.formatted(MAX_HOPS),
                Map.of("fromId", fromId, "toId", toId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Map<String, Object>> entitiesByQuality(QualityLevel level) {
        return run(AnalyticsQueries.ENTITIES_BY_QUALITY, Map.of("qualityLevel", level.name()));
    }

    public List<Map<String, Object>> entitiesByCompliance(ComplianceStatus status) {
        return run(AnalyticsQueries.ENTITIES_BY_COMPLIANCE, Map.of("status", status.name()));
    }

    /**
     * Runs caller-supplied Cypher. Only reading queries are accepted.
     */
    public List<Map<String, Object>> executeQuery(String cypher, Map<String, Object> params) {
        if (cypher == null || cypher.isBlank()) {
            throw new QueryExecutionException("Query must not be blank", cypher);
        }
        String withoutLiterals = STRING_LITERAL.matcher(cypher).replaceAll("''");
        if (MUTATING.matcher(withoutLiterals).find()) {
            throw new QueryExecutionException("Ad-hoc queries must be read-only", cypher);
        }
        return run(cypher, params != null ? params : Map.of());
    }

    /**
     * Runs every fixed query and collects the results.
     */
    public AnalysisReport runAnalysis() {
        try (LogContext ctx = LogContext.forAnalysis(connection.getGraphName())) {
            Map<String, List<Map<String, Object>>> sections = new LinkedHashMap<>();
            sections.put("databaseSummary", List.of(databaseSummary()));
            sections.put("entityTypeDistribution", entityTypeDistribution());
            sections.put("relationshipTypeDistribution", relationshipTypeDistribution());
            sections.put("qualityDistribution", qualityDistribution());
            sections.put("complianceSummary", complianceSummary());
            sections.put("relationshipPatterns", relationshipPatterns());
            sections.put("shellsWithMostSubmodels", shellsWithMostSubmodels(10));
            sections.put("isolatedNodes", isolatedNodes());
            log.info("analysis.completed graph={} sections={}", connection.getGraphName(), sections.size());
            return new AnalysisReport(connection.getGraphName(),
                    DateTimeFormatter.ISO_INSTANT.format(clock.instant()), sections);
        }
    }

    private List<Map<String, Object>> run(String query, Map<String, Object> params) {
        try {
            List<Map<String, Object>> rows = connection.query(query, params);
            log.debug("analytics.query rows={}", rows.size());
            return rows;
        } catch (RuntimeException e) {
            log.warn("analytics.queryFailed error={} query={}", e.getMessage(), query.strip());
            throw new QueryExecutionException("Query failed: " + e.getMessage(), query, e);
        }
    }

    private static int requireHops(int maxHops) {
        if (maxHops < 1 || maxHops > MAX_HOPS) {
            throw new IllegalArgumentException("maxHops must be between 1 and " + MAX_HOPS + ", was " + maxHops);
        }
        return maxHops;
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }

    private static long firstLong(List<Map<String, Object>> rows, String column) {
        return rows.isEmpty() ? 0L : toLong(rows.get(0).get(column));
    }

    private static long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static <E extends Enum<E>> Optional<E> parseEnum(Class<E> type, Object value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Enum.valueOf(type, value.toString()));
        } catch (IllegalArgumentException e) {
            log.debug("analytics.unknownValue type={} value={}", type.getSimpleName(), value);
            return Optional.empty();
        }
    }
}
