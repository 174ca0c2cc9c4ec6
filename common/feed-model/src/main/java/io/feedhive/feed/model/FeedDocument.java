package io.feedhive.feed.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw shape of a feed configuration file as read by Jackson, before validation and defaults.
 */
final class FeedDocument {

    @JsonProperty("name")
    String name;

    @JsonProperty("url")
    @JsonAlias({"source", "source_url"})
    String url;

    @JsonProperty("sparql_endpoint")
    @JsonAlias({"target", "target_endpoint"})
    String sparqlEndpoint;

    @JsonProperty("target_graph")
    String targetGraph;

    @JsonProperty("shape")
    String shape;

    @JsonProperty("polling_interval")
    Double pollingInterval;

    @JsonProperty("follow")
    Boolean follow;

    @JsonProperty("materialize")
    Boolean materialize;

    @JsonProperty("order")
    String order;

    @JsonProperty("last_version_only")
    Boolean lastVersionOnly;

    @JsonProperty("failure_is_fatal")
    Boolean failureIsFatal;

    @JsonProperty("concurrent_fetches")
    Integer concurrentFetches;

    @JsonProperty("query_timeout")
    Double queryTimeout;

    @JsonProperty("for_virtuoso")
    Boolean forVirtuoso;

    @JsonProperty("before")
    String before;

    @JsonProperty("after")
    String after;

    @JsonProperty("access_token")
    String accessToken;

    @JsonProperty("perf_name")
    String perfName;

    @JsonProperty("environment")
    Map<String, Object> environment;

    final Map<String, Object> unrecognised = new LinkedHashMap<>();

    @JsonAnySetter
    void unrecognised(String key, Object value) {
        unrecognised.put(key, value);
    }
}
