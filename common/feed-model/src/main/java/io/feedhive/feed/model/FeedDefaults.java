package io.feedhive.feed.model;

import java.time.Duration;

/**
 * Values applied to optional feed fields that a configuration entry leaves out.
 * <p>
 * Durations are configured in seconds. {@link #POLLING_INTERVAL} reaches the worker as
 * milliseconds ({@code POLLING_FREQUENCY = seconds x 1000}); {@link #QUERY_TIMEOUT} is passed
 * through in seconds.
 */
public final class FeedDefaults {

    public static final Duration POLLING_INTERVAL = Duration.ofSeconds(60);
    public static final boolean FOLLOW = true;
    public static final boolean MATERIALIZE = false;
    public static final OrderMode ORDER = OrderMode.NONE;
    public static final boolean LAST_VERSION_ONLY = false;
    public static final boolean FAILURE_IS_FATAL = false;
    public static final int CONCURRENT_FETCHES = 10;
    public static final Duration QUERY_TIMEOUT = Duration.ofSeconds(1800);
    public static final boolean FOR_VIRTUOSO = false;
    public static final String SHAPE = "";
    public static final String TARGET_GRAPH = "";

    private FeedDefaults() {
    }
}
