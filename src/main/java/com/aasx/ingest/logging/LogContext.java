package com.aasx.ingest.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Scoped SLF4J MDC entries, removed again on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forExtraction("motor.aasx")) {
 *     log.info("extraction.completed assets={}", assets);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forExtraction(String container) {
        LogContext ctx = new LogContext();
        ctx.put("container", container);
        ctx.put("operation", "extract");
        return ctx;
    }

    public static LogContext forImport(String batch, String sourceFile) {
        LogContext ctx = new LogContext();
        ctx.put("batch", batch);
        ctx.put("sourceFile", sourceFile);
        ctx.put("operation", "import");
        return ctx;
    }

    public static LogContext forAnalysis(String graphName) {
        LogContext ctx = new LogContext();
        ctx.put("graph", graphName);
        ctx.put("operation", "analyze");
        return ctx;
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value != null ? value : "");
    }

    @Override
    public void close() {
        keys.forEach(MDC::remove);
        keys.clear();
    }
}
