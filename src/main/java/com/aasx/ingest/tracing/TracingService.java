package com.aasx.ingest.tracing;

import java.util.Map;

/**
 * Span factory. {@link NoOpTracingService} is the default so OpenTelemetry stays optional.
 */
public interface TracingService {

    /**
     * Starts a span; close it to end it.
     *
     * @param operationName span name, e.g. {@code aasx.import}
     * @param attributes    initial attributes
     * @return the started span
     */
    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span without attributes.
     *
     * @param operationName span name
     * @return the started span
     */
    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
