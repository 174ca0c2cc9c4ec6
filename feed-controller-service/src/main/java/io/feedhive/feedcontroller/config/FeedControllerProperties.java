package io.feedhive.feedcontroller.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "feedhive.controller")
public class FeedControllerProperties {

    public static final String GROUP_LABEL = "feedhive.group";
    public static final String FEED_LABEL = "feedhive.feed";
    public static final String SPEC_HASH_LABEL = "feedhive.spec-hash";
    public static final String IMAGE_LABEL = "feedhive.image";
    public static final String COMPOSE_PROJECT_LABEL = "com.docker.compose.project";
    public static final String COMPOSE_SERVICE_LABEL = "com.docker.compose.service";

    private final Path configDir;
    private final Path stateRoot;
    private final Path hostStateRoot;
    private final Path logsDir;
    private final Lock lock;
    private final Worker worker;
    private final Timing timing;
    private final Docker docker;

    public FeedControllerProperties(@NotBlank String configDir,
                                    @NotBlank String stateRoot,
                                    String hostStateRoot,
                                    String logsDir,
                                    @Valid Lock lock,
                                    @Valid Worker worker,
                                    @Valid Timing timing,
                                    @Valid Docker docker) {
        this.configDir = Path.of(requireNonBlank(configDir, "configDir"));
        this.stateRoot = Path.of(requireNonBlank(stateRoot, "stateRoot"));
        this.hostStateRoot = isBlank(hostStateRoot) ? this.stateRoot : Path.of(hostStateRoot);
        this.logsDir = isBlank(logsDir) ? null : Path.of(logsDir);
        Lock resolvedLock = lock != null ? lock : new Lock(null, null, null);
        this.lock = resolvedLock.path() != null
            ? resolvedLock
            : new Lock(this.configDir.resolve(".spawn.lock").toString(), resolvedLock.retries(), resolvedLock.backoff());
        this.worker = worker != null ? worker : new Worker(null, null, null, null, null, null, null);
        this.timing = timing != null ? timing : new Timing(null, null, null, null, null, null, null, null);
        this.docker = docker != null ? docker : new Docker(null, null);
    }

    public Path getConfigDir() {
        return configDir;
    }

    public Path getStateRoot() {
        return stateRoot;
    }

    public Path getHostStateRoot() {
        return hostStateRoot;
    }

    /**
     * Directory for worker diagnostics files, or {@code null} when diagnostics are only logged.
     */
    public Path getLogsDir() {
        return logsDir;
    }

    public Lock getLock() {
        return lock;
    }

    public Worker getWorker() {
        return worker;
    }

    public Timing getTiming() {
        return timing;
    }

    public Docker getDocker() {
        return docker;
    }

    /**
     * Label filter selecting every container that belongs to this controller's group.
     */
    public Map<String, String> groupLabels() {
        return Map.of(GROUP_LABEL, worker.group());
    }

    @Validated
    public static final class Lock {
        private final Path path;
        private final int retries;
        private final Duration backoff;

        public Lock(String path, @Min(0) Integer retries, Duration backoff) {
            this.path = isBlank(path) ? null : Path.of(path);
            this.retries = retries != null ? retries : 10;
            this.backoff = backoff != null ? backoff : Duration.ofSeconds(1);
        }

        public Path path() {
            return path;
        }

        public int retries() {
            return retries;
        }

        public Duration backoff() {
            return backoff;
        }
    }

    @Validated
    public static final class Worker {
        private final String image;
        private final String network;
        private final String project;
        private final String group;
        private final String namePrefix;
        private final String logLevel;
        private final boolean removeContainers;

        public Worker(String image,
                      String network,
                      String project,
                      String group,
                      String namePrefix,
                      String logLevel,
                      Boolean removeContainers) {
            this.image = orDefault(image, "ghcr.io/maregraph-eu/ldes2sparql:latest");
            this.network = network;
            this.project = orDefault(project, "kgap");
            this.group = orDefault(group, "ldes-consumer");
            this.namePrefix = orDefault(namePrefix, "ldes-consumer");
            this.logLevel = orDefault(logLevel, "info").toLowerCase(Locale.ROOT);
            this.removeContainers = removeContainers == null || removeContainers;
        }

        public String image() {
            return image;
        }

        /**
         * Configured network, or {@code null} to detect the network of the controller's own container.
         */
        public String network() {
            return network;
        }

        public String project() {
            return project;
        }

        public String group() {
            return group;
        }

        public String namePrefix() {
            return namePrefix;
        }

        public String logLevel() {
            return logLevel;
        }

        public boolean removeContainers() {
            return removeContainers;
        }
    }

    @Validated
    public static final class Timing {
        private final Duration debounce;
        private final Duration rescanInterval;
        private final Duration healthPollInterval;
        private final Duration reconcileInterval;
        private final Duration launchTimeout;
        private final Duration stopTimeout;
        private final int stopRetries;
        private final Duration shutdownGrace;

        public Timing(Duration debounce,
                      Duration rescanInterval,
                      Duration healthPollInterval,
                      Duration reconcileInterval,
                      Duration launchTimeout,
                      Duration stopTimeout,
                      @Min(1) Integer stopRetries,
                      Duration shutdownGrace) {
            this.debounce = orDefault(debounce, Duration.ofMillis(1500));
            this.rescanInterval = orDefault(rescanInterval, Duration.ofSeconds(30));
            this.healthPollInterval = orDefault(healthPollInterval, Duration.ofSeconds(30));
            this.reconcileInterval = orDefault(reconcileInterval, Duration.ofSeconds(30));
            this.launchTimeout = orDefault(launchTimeout, Duration.ofSeconds(5));
            this.stopTimeout = orDefault(stopTimeout, Duration.ofSeconds(30));
            this.stopRetries = stopRetries != null ? stopRetries : 3;
            this.shutdownGrace = orDefault(shutdownGrace, Duration.ofSeconds(60));
        }

        public Duration debounce() {
            return debounce;
        }

        public Duration rescanInterval() {
            return rescanInterval;
        }

        public Duration healthPollInterval() {
            return healthPollInterval;
        }

        public Duration reconcileInterval() {
            return reconcileInterval;
        }

        public Duration launchTimeout() {
            return launchTimeout;
        }

        public Duration stopTimeout() {
            return stopTimeout;
        }

        public int stopRetries() {
            return stopRetries;
        }

        public Duration shutdownGrace() {
            return shutdownGrace;
        }

        private static Duration orDefault(Duration value, Duration fallback) {
            return value != null && !value.isNegative() ? value : fallback;
        }
    }

    @Validated
    public static final class Docker {
        private final String host;
        private final String socketPath;

        public Docker(String host, String socketPath) {
            this.host = host;
            this.socketPath = orDefault(socketPath, "/var/run/docker.sock");
        }

        public String host() {
            return host;
        }

        public String socketPath() {
            return socketPath;
        }

        public boolean hasHost() {
            return host != null && !host.isBlank();
        }
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String requireNonBlank(String value, String name) {
        if (isBlank(value)) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
