package io.feedhive.feed.model;

import java.util.Locale;

/**
 * Order in which a worker emits members of a feed.
 */
public enum OrderMode {
    NONE,
    ASC,
    DESC;

    /**
     * Lowercase token understood by the worker ({@code none}, {@code asc}, {@code desc}).
     */
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static OrderMode fromToken(String value) {
        if (value == null || value.isBlank()) {
            return FeedDefaults.ORDER;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (OrderMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("order must be one of none, asc, desc but was '" + value + "'");
    }
}
