package com.aasx.ingest.graph;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Connection settings for the graph store, read once at startup and passed to
 * {@link FalkorDBConnection} and the readiness probe.
 */
public final class GraphStoreConfig {

    public static final int DEFAULT_PORT = 6379;
    // plain-text schemes only; the connection is built without TLS
    private static final Set<String> SCHEMES = Set.of("redis", "falkor", "falkordb");

    private final URI uri;
    private final String principal;
    private final String credential;
    private final String graphName;
    private final Duration readinessTimeout;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    private GraphStoreConfig(Builder builder) {
        this.uri = builder.uri;
        this.principal = builder.principal;
        this.credential = builder.credential;
        this.graphName = builder.graphName;
        this.readinessTimeout = builder.readinessTimeout;
        this.initialBackoff = builder.initialBackoff;
        this.maxBackoff = builder.maxBackoff;
    }

    public URI getUri() { return uri; }
    public String getHost() { return uri.getHost() != null ? uri.getHost() : "localhost"; }
    public int getPort() { return uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT; }
    public String getPrincipal() { return principal; }
    public String getCredential() { return credential; }
    public boolean hasCredentials() { return !credential.isEmpty(); }
    public String getGraphName() { return graphName; }
    public Duration getReadinessTimeout() { return readinessTimeout; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public Duration getMaxBackoff() { return maxBackoff; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI uri = URI.create("redis://localhost:" + DEFAULT_PORT);
        private String principal = "";
        private String credential = "";
        private String graphName = "aasx";
        private Duration readinessTimeout = Duration.ofSeconds(60);
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration maxBackoff = Duration.ofSeconds(8);

        public Builder uri(String uri) {
            if (uri == null || uri.isBlank()) {
                throw new IllegalArgumentException("uri must not be blank");
            }
            URI parsed = URI.create(uri.trim());
            String scheme = parsed.getScheme();
            if (scheme == null || !SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Unsupported graph store URI scheme: " + uri);
            }
            if (parsed.getHost() == null) {
                throw new IllegalArgumentException("Graph store URI has no host: " + uri);
            }
            this.uri = parsed;
            return this;
        }

        public Builder principal(String principal) {
            this.principal = principal != null ? principal : "";
            return this;
        }

        public Builder credential(String credential) {
            this.credential = credential != null ? credential : "";
            return this;
        }

        public Builder graphName(String graphName) {
            if (graphName == null || graphName.isBlank()) {
                throw new IllegalArgumentException("graphName must not be blank");
            }
            this.graphName = graphName;
            return this;
        }

        public Builder readinessTimeout(Duration readinessTimeout) {
            if (readinessTimeout == null || readinessTimeout.isNegative()) {
                throw new IllegalArgumentException("readinessTimeout must be >= 0");
            }
            this.readinessTimeout = readinessTimeout;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
                throw new IllegalArgumentException("initialBackoff must be > 0");
            }
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            if (maxBackoff == null || maxBackoff.isNegative() || maxBackoff.isZero()) {
                throw new IllegalArgumentException("maxBackoff must be > 0");
            }
            this.maxBackoff = maxBackoff;
            return this;
        }

        public GraphStoreConfig build() {
            if (maxBackoff.compareTo(initialBackoff) < 0) {
                throw new IllegalArgumentException("maxBackoff cannot be shorter than initialBackoff");
            }
            Objects.requireNonNull(uri, "uri is required");
            return new GraphStoreConfig(this);
        }
    }

    @Override
    public String toString() {
        return "GraphStoreConfig{" +
                "uri=" + uri +
                ", principal='" + principal + '\'' +
                ", credential=" + (credential.isEmpty() ? "''" : "****") +
                ", graphName='" + graphName + '\'' +
                ", readinessTimeout=" + readinessTimeout +
                ", initialBackoff=" + initialBackoff +
                ", maxBackoff=" + maxBackoff +
                '}';
    }
}
