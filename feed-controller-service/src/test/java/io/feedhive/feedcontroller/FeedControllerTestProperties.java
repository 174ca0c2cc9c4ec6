package io.feedhive.feedcontroller;

import io.feedhive.feedcontroller.config.FeedControllerProperties;
import java.nio.file.Path;
import java.time.Duration;

public final class FeedControllerTestProperties {

    public static final String IMAGE = "ghcr.io/example/ldes2sparql:test";
    public static final String NETWORK = "kgap_default";
    public static final String GROUP = "ldes-consumer";

    private FeedControllerTestProperties() {
    }

    /**
     * Fast timings rooted at {@code root}: no launch confirmation wait, no periodic work.
     */
    public static FeedControllerProperties under(Path root) {
        return under(root, true);
    }

    public static FeedControllerProperties under(Path root, boolean removeContainers) {
        return new FeedControllerProperties(
            root.resolve("feeds").toString(),
            root.resolve("state").toString(),
            "/srv/ldes/state",
            root.resolve("logs").toString(),
            new FeedControllerProperties.Lock(null, 0, Duration.ofMillis(10)),
            new FeedControllerProperties.Worker(IMAGE, NETWORK, "kgap", GROUP, "ldes-consumer", "debug",
                removeContainers),
            new FeedControllerProperties.Timing(
                Duration.ofMillis(100),
                Duration.ofHours(1),
                Duration.ofHours(1),
                Duration.ofHours(1),
                Duration.ZERO,
                Duration.ofSeconds(1),
                2,
                Duration.ofSeconds(5)),
            new FeedControllerProperties.Docker(null, "/var/run/docker.sock"));
    }
}
