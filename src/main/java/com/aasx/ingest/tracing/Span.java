package com.aasx.ingest.tracing;

/**
 * One traced unit of work; ends when closed.
 */
public interface Span extends AutoCloseable {

    /**
     * Adds a text attribute.
     *
     * @return this span
     */
    Span attribute(String key, String value);

    /**
     * Adds a numeric attribute.
     *
     * @return this span
     */
    Span attribute(String key, long value);

    /**
     * Marks the unit of work as successful.
     */
    void succeeded();

    /**
     * Marks the unit of work as failed and records the exception.
     *
     * @param cause the failure
     */
    void failed(Throwable cause);

    @Override
    void close();
}
