package com.aasx.ingest.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Writes an {@link AnalysisReport} as CSV, one block per section:
 *
 * <pre>
 * # qualityDistribution
 * elementType,qualityLevel,count
 * Shell,HIGH,3
 * </pre>
 */
public class CsvAnalysisExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvAnalysisExporter.class);

    public void export(AnalysisReport report, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            export(report, writer);
        }
        log.info("analysis.exported file={} sections={}", target, report.sections().size());
    }

    /**
     * @return number of data rows written
     */
    public long export(AnalysisReport report, Writer writer) {
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        long rows = 0;
        boolean first = true;
        for (Map.Entry<String, List<Map<String, Object>>> section : report.sections().entrySet()) {
            if (!first) {
                pw.println();
            }
            first = false;
            pw.println("# " + section.getKey());

            List<String> columns = columns(section.getValue());
            pw.println(String.join(",", columns));
            for (Map<String, Object> row : section.getValue()) {
                StringJoiner line = new StringJoiner(",");
                for (String column : columns) {
                    line.add(csvEscape(format(row.get(column))));
                }
                pw.println(line);
                rows++;
            }
        }
        pw.flush();
        return rows;
    }

    private static List<String> columns(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new ArrayList<>(columns);
    }

    private static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            StringJoiner joiner = new StringJoiner(";");
            collection.forEach(element -> joiner.add(String.valueOf(element)));
            return joiner.toString();
        }
        return value.toString();
    }

    private static String csvEscape(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
