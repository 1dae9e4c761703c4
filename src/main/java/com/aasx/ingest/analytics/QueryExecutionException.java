package com.aasx.ingest.analytics;

/**
 * Thrown when an analytics query is rejected or fails in the store. Carries the
 * offending query text.
 */
public class QueryExecutionException extends RuntimeException {

    private final String query;

    public QueryExecutionException(String message, String query) {
        super(message);
        this.query = query;
    }

    public QueryExecutionException(String message, String query, Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
