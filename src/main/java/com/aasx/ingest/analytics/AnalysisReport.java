package com.aasx.ingest.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named result sections of a full analysis run, in execution order.
 */
public record AnalysisReport(String graphName, String generatedAt, Map<String, List<Map<String, Object>>> sections) {

    public AnalysisReport {
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        sections.forEach((name, rows) -> copy.put(name, List.copyOf(rows)));
        sections = Collections.unmodifiableMap(copy);
    }

    public List<Map<String, Object>> section(String name) {
        return sections.getOrDefault(name, List.of());
    }
}
