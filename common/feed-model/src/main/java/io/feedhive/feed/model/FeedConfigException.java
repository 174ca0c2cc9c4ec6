package io.feedhive.feed.model;

/**
 * Raised when a feed configuration entry is malformed or incomplete.
 * <p>
 * The entry is excluded from the desired state; other entries are unaffected.
 */
public class FeedConfigException extends RuntimeException {

    private final String source;

    public FeedConfigException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public FeedConfigException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    /**
     * File name (or other label) of the offending entry.
     */
    public String source() {
        return source;
    }
}
