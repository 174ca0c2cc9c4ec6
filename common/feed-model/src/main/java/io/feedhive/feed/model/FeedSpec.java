package io.feedhive.feed.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Typed, defaulted description of one configured feed.
 * <p>
 * {@link #name()} is the identity. Every other component except {@link #sourceFile()} affects
 * worker behaviour and therefore participates in {@link #contentHash()}; two specs with equal
 * hashes are behaviourally identical.
 */
public record FeedSpec(String name,
                       String sourceUrl,
                       String targetEndpoint,
                       String targetGraph,
                       String shape,
                       Duration pollingInterval,
                       boolean follow,
                       boolean materialize,
                       OrderMode order,
                       boolean lastVersionOnly,
                       boolean failureIsFatal,
                       int concurrentFetches,
                       Duration queryTimeout,
                       boolean forVirtuoso,
                       String before,
                       String after,
                       String accessToken,
                       String perfName,
                       Map<String, String> environment,
                       String sourceFile) {

    public FeedSpec {
        name = requireNonBlank(name, "name");
        sourceUrl = requireNonBlank(sourceUrl, "sourceUrl");
        targetEndpoint = requireNonBlank(targetEndpoint, "targetEndpoint");
        targetGraph = targetGraph == null ? FeedDefaults.TARGET_GRAPH : targetGraph;
        shape = shape == null ? FeedDefaults.SHAPE : shape;
        pollingInterval = pollingInterval == null ? FeedDefaults.POLLING_INTERVAL : pollingInterval;
        order = order == null ? FeedDefaults.ORDER : order;
        queryTimeout = queryTimeout == null ? FeedDefaults.QUERY_TIMEOUT : queryTimeout;
        environment = environment == null || environment.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(environment));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Hex SHA-256 over every behaviour-affecting field in a fixed order.
     */
    public String contentHash() {
        StringBuilder canonical = new StringBuilder(256);
        append(canonical, "source", sourceUrl);
        append(canonical, "target", targetEndpoint);
        append(canonical, "targetGraph", targetGraph);
        append(canonical, "shape", shape);
        append(canonical, "pollingMillis", Long.toString(pollingInterval.toMillis()));
        append(canonical, "follow", Boolean.toString(follow));
        append(canonical, "materialize", Boolean.toString(materialize));
        append(canonical, "order", order.token());
        append(canonical, "lastVersionOnly", Boolean.toString(lastVersionOnly));
        append(canonical, "failureIsFatal", Boolean.toString(failureIsFatal));
        append(canonical, "concurrentFetches", Integer.toString(concurrentFetches));
        append(canonical, "queryTimeoutSeconds", Long.toString(queryTimeout.toSeconds()));
        append(canonical, "forVirtuoso", Boolean.toString(forVirtuoso));
        append(canonical, "before", before);
        append(canonical, "after", after);
        append(canonical, "accessToken", accessToken);
        append(canonical, "perfName", perfName);
        environment.forEach((key, value) -> append(canonical, "env." + key, value));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean hasAccessToken() {
        return accessToken != null && !accessToken.isBlank();
    }

    @Override
    public String toString() {
        return "FeedSpec[name=" + name
            + ", sourceUrl=" + sourceUrl
            + ", targetEndpoint=" + targetEndpoint
            + ", targetGraph=" + targetGraph
            + ", pollingInterval=" + pollingInterval
            + ", order=" + order.token()
            + ", failureIsFatal=" + failureIsFatal
            + ", accessToken=" + (hasAccessToken() ? "****" : "<none>")
            + ", environment=" + environment.keySet()
            + ", sourceFile=" + sourceFile + "]";
    }

    private static void append(StringBuilder target, String key, String value) {
        target.append(key).append('=');
        if (value != null) {
            target.append(value.length()).append(':').append(value);
        } else {
            target.append('-');
        }
        target.append('\n');
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    public static final class Builder {
        private final String name;
        private String sourceUrl;
        private String targetEndpoint;
        private String targetGraph;
        private String shape;
        private Duration pollingInterval;
        private boolean follow = FeedDefaults.FOLLOW;
        private boolean materialize = FeedDefaults.MATERIALIZE;
        private OrderMode order;
        private boolean lastVersionOnly = FeedDefaults.LAST_VERSION_ONLY;
        private boolean failureIsFatal = FeedDefaults.FAILURE_IS_FATAL;
        private int concurrentFetches = FeedDefaults.CONCURRENT_FETCHES;
        private Duration queryTimeout;
        private boolean forVirtuoso = FeedDefaults.FOR_VIRTUOSO;
        private String before;
        private String after;
        private String accessToken;
        private String perfName;
        private Map<String, String> environment = Map.of();
        private String sourceFile;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder targetEndpoint(String targetEndpoint) {
            this.targetEndpoint = targetEndpoint;
            return this;
        }

        public Builder targetGraph(String targetGraph) {
            this.targetGraph = targetGraph;
            return this;
        }

        public Builder shape(String shape) {
            this.shape = shape;
            return this;
        }

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder follow(boolean follow) {
            this.follow = follow;
            return this;
        }

        public Builder materialize(boolean materialize) {
            this.materialize = materialize;
            return this;
        }

        public Builder order(OrderMode order) {
            this.order = order;
            return this;
        }

        public Builder lastVersionOnly(boolean lastVersionOnly) {
            this.lastVersionOnly = lastVersionOnly;
            return this;
        }

        public Builder failureIsFatal(boolean failureIsFatal) {
            this.failureIsFatal = failureIsFatal;
            return this;
        }

        public Builder concurrentFetches(int concurrentFetches) {
            this.concurrentFetches = concurrentFetches;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder forVirtuoso(boolean forVirtuoso) {
            this.forVirtuoso = forVirtuoso;
            return this;
        }

        public Builder before(String before) {
            this.before = before;
            return this;
        }

        public Builder after(String after) {
            this.after = after;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder perfName(String perfName) {
            this.perfName = perfName;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public FeedSpec build() {
            return new FeedSpec(name, sourceUrl, targetEndpoint, targetGraph, shape, pollingInterval,
                follow, materialize, order, lastVersionOnly, failureIsFatal, concurrentFetches,
                queryTimeout, forVirtuoso, before, after, accessToken, perfName, environment, sourceFile);
        }
    }
}
