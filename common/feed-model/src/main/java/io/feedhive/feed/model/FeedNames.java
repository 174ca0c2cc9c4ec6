package io.feedhive.feed.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Naming rules shared by configuration files, feed identities and worker containers.
 */
public final class FeedNames {

    private static final Pattern VALID_NAME = Pattern.compile("[a-z0-9][a-z0-9.-]*");

    private FeedNames() {
    }

    public static boolean isFeedFile(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        String name = file.getFileName().toString();
        if (name.startsWith(".")) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml");
    }

    /**
     * Feed name derived from a configuration file name, e.g. {@code Feed_A.yaml -> feed-a}.
     */
    public static String fromFileName(String fileName) {
        String stem = fileName;
        String lower = stem.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yaml")) {
            stem = stem.substring(0, stem.length() - ".yaml".length());
        } else if (lower.endsWith(".yml")) {
            stem = stem.substring(0, stem.length() - ".yml".length());
        }
        return sanitize(stem);
    }

    public static String sanitize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim().replace('_', '-').replace(' ', '-').toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    public static String containerName(String prefix, String feedName) {
        return prefix + "-" + feedName;
    }
}
