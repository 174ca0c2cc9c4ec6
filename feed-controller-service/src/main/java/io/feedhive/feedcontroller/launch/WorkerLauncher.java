package io.feedhive.feedcontroller.launch;

import static io.feedhive.feedcontroller.config.FeedControllerProperties.COMPOSE_PROJECT_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.COMPOSE_SERVICE_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.FEED_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.GROUP_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.IMAGE_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.SPEC_HASH_LABEL;

import io.feedhive.feed.model.FeedNames;
import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import io.feedhive.feedcontroller.runtime.LaunchSpec;
import io.feedhive.feedcontroller.runtime.RuntimeClient;
import io.feedhive.feedcontroller.runtime.RuntimeWorker;
import io.feedhive.feedcontroller.state.WorkerHandle;
import io.feedhive.feedcontroller.state.WorkerStatus;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link FeedSpec} into a running worker and takes workers down again.
 * <p>
 * All calls block and are made from the reconciler's runtime executor, never from the
 * reconciliation thread itself.
 */
public class WorkerLauncher {

  private static final Logger log = LoggerFactory.getLogger(WorkerLauncher.class);

  static final int DIAGNOSTIC_LINES = 50;
  static final String STATE_MOUNT_POINT = "/state";
  private static final DateTimeFormatter DIAGNOSTICS_STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

  private final RuntimeClient runtime;
  private final FeedControllerProperties properties;
  private final WorkerEnvironment environment;
  private final Clock clock;
  private final Duration stopRetryPause;
  private volatile String network;
  private volatile boolean networkResolved;

  public WorkerLauncher(RuntimeClient runtime,
                        FeedControllerProperties properties,
                        WorkerEnvironment environment,
                        Clock clock) {
    this(runtime, properties, environment, clock, Duration.ofSeconds(1));
  }

  public WorkerLauncher(RuntimeClient runtime,
                        FeedControllerProperties properties,
                        WorkerEnvironment environment,
                        Clock clock,
                        Duration stopRetryPause) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.stopRetryPause = Objects.requireNonNull(stopRetryPause, "stopRetryPause");
  }

  /**
   * Launch a worker for {@code spec} and wait for it to be confirmed running.
   * Never throws: every failure is reported in the returned outcome.
   */
  public LaunchOutcome launch(FeedSpec spec) {
    String feed = spec.name();
    try {
      removeLeftovers(feed);
    } catch (RuntimeException e) {
      return LaunchOutcome.failed(null, "unable to clean up previous workers: " + e.getMessage(), null);
    }

    Path stateDir = properties.getStateRoot().resolve(feed);
    try {
      prepareStateDirectory(feed, stateDir);
    } catch (IOException e) {
      log.error("feed {}: unable to prepare state directory {}: {}", feed, stateDir, e.getMessage());
      return LaunchOutcome.failed(null, "unable to prepare state directory " + stateDir, null);
    }

    LaunchSpec launchSpec = launchSpec(spec);
    log.info("launching worker {} for feed {} (spec {})", launchSpec.name(), feed, shortHash(spec.contentHash()));
    log.debug("worker env for {}: {}", launchSpec.name(), WorkerEnvironment.describe(launchSpec.environment()));
    String runtimeId;
    try {
      runtimeId = runtime.launch(launchSpec);
    } catch (RuntimeException e) {
      log.error("feed {}: unable to launch worker: {}", feed, e.getMessage());
      return LaunchOutcome.failed(null, "launch failed: " + e.getMessage(), null);
    }

    String failure = awaitRunning(runtimeId);
    if (failure == null) {
      log.info("worker {} for feed {} is running", runtimeId, feed);
      return LaunchOutcome.started(runtimeId);
    }
    String diagnostics = captureDiagnostics(feed, runtimeId, failure);
    String keptId = runtimeId;
    if (properties.getWorker().removeContainers()) {
      try {
        runtime.remove(runtimeId);
        keptId = null;
      } catch (RuntimeException e) {
        log.warn("feed {}: unable to remove failed worker {}: {}", feed, runtimeId, e.getMessage());
      }
    }
    return LaunchOutcome.failed(keptId, failure, diagnostics);
  }

  /**
   * Stop a worker, retrying a bounded number of times.
   *
   * @return {@code true} once the worker is stopped (and removed, when containers are removed)
   */
  public boolean stop(String feed, String runtimeId) {
    int attempts = properties.getTiming().stopRetries();
    boolean remove = properties.getWorker().removeContainers();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        runtime.stop(runtimeId, properties.getTiming().stopTimeout());
        if (remove) {
          runtime.remove(runtimeId);
        }
        log.info("stopped worker {} for feed {}{}", runtimeId, feed, remove ? " and removed it" : "");
        return true;
      } catch (RuntimeException e) {
        log.warn("feed {}: stop of worker {} failed (attempt {}/{}): {}",
            feed, runtimeId, attempt, attempts, e.getMessage());
        if (attempt < attempts && !pause(stopRetryPause.multipliedBy(attempt))) {
          break;
        }
      }
    }
    log.warn("feed {}: giving up stopping worker {}", feed, runtimeId);
    return false;
  }

  /**
   * Reconcile workers left behind by a previous controller against the desired feeds: a running
   * worker whose spec hash and image match is adopted, every other worker of the group is
   * stopped and removed.
   */
  public List<WorkerHandle> adoptExisting(Map<String, FeedSpec> desired) {
    String image = properties.getWorker().image();
    Map<String, WorkerHandle> adopted = new LinkedHashMap<>();
    for (RuntimeWorker worker : runtime.list(properties.groupLabels())) {
      String feed = worker.label(FEED_LABEL);
      FeedSpec spec = feed == null ? null : desired.get(feed);
      String reason = null;
      if (spec == null) {
        reason = "feed is not configured";
      } else if (!worker.running()) {
        reason = "worker is " + worker.describe();
      } else if (!spec.contentHash().equals(worker.label(SPEC_HASH_LABEL))) {
        reason = "configuration changed";
      } else if (!image.equals(worker.label(IMAGE_LABEL))) {
        reason = "image changed";
      } else if (adopted.containsKey(feed)) {
        reason = "duplicate worker";
      }
      if (reason == null) {
        log.info("adopting running worker {} ({}) for feed {}", worker.name(), worker.runtimeId(), feed);
        adopted.put(feed, new WorkerHandle(feed, worker.runtimeId(), spec.contentHash(),
            WorkerStatus.RUNNING, clock.instant()));
      } else {
        log.info("removing worker {} ({}): {}", worker.name(), worker.runtimeId(), reason);
        discard(worker, feed);
      }
    }
    return new ArrayList<>(adopted.values());
  }

  LaunchSpec launchSpec(FeedSpec spec) {
    String feed = spec.name();
    FeedControllerProperties.Worker worker = properties.getWorker();
    Map<String, String> labels = new HashMap<>();
    labels.put(COMPOSE_PROJECT_LABEL, worker.project());
    labels.put(COMPOSE_SERVICE_LABEL, worker.group());
    labels.put(GROUP_LABEL, worker.group());
    labels.put(FEED_LABEL, feed);
    labels.put(SPEC_HASH_LABEL, spec.contentHash());
    labels.put(IMAGE_LABEL, worker.image());
    String volume = properties.getHostStateRoot().resolve(feed) + ":" + STATE_MOUNT_POINT;
    return new LaunchSpec(FeedNames.containerName(worker.namePrefix(), feed), worker.image(),
        environment.build(spec), network(), labels, volume);
  }

  private String network() {
    if (!networkResolved) {
      network = runtime.resolveNetwork(properties.getWorker().network());
      networkResolved = true;
    }
    return network;
  }

  private void removeLeftovers(String feed) {
    Map<String, String> filter = new HashMap<>(properties.groupLabels());
    filter.put(FEED_LABEL, feed);
    for (RuntimeWorker leftover : runtime.list(filter)) {
      if (leftover.running()) {
        log.warn("feed {}: stopping untracked running worker {} ({})", feed, leftover.name(), leftover.runtimeId());
      } else {
        log.info("feed {}: removing previous worker {} ({})", feed, leftover.name(), leftover.describe());
      }
      discard(leftover, feed);
    }
  }

  private void discard(RuntimeWorker worker, String feed) {
    if (worker.running()) {
      runtime.stop(worker.runtimeId(), properties.getTiming().stopTimeout());
    } else if (feed != null && worker.exitCode() != null && worker.exitCode() != 0) {
      captureDiagnostics(feed, worker.runtimeId(), "previous worker " + worker.describe());
    }
    runtime.remove(worker.runtimeId());
  }

  private void prepareStateDirectory(String feed, Path stateDir) throws IOException {
    if (Files.isDirectory(stateDir)) {
      try (Stream<Path> existing = Files.list(stateDir)) {
        if (existing.findAny().isPresent()) {
          log.info("feed {}: reusing persisted state in {}", feed, stateDir);
        }
      }
      return;
    }
    Files.createDirectories(stateDir);
  }

  private String awaitRunning(String runtimeId) {
    Duration timeout = properties.getTiming().launchTimeout();
    long deadline = System.nanoTime() + timeout.toNanos();
    long pollMillis = Math.min(250L, Math.max(10L, timeout.toMillis() / 10));
    while (true) {
      Optional<RuntimeWorker> probe;
      try {
        probe = runtime.inspect(runtimeId);
      } catch (RuntimeException e) {
        return "unable to inspect worker: " + e.getMessage();
      }
      if (probe.isEmpty()) {
        return "worker disappeared after launch";
      }
      RuntimeWorker worker = probe.get();
      if (!worker.running() && !"created".equalsIgnoreCase(worker.state())
          && !"restarting".equalsIgnoreCase(worker.state())) {
        return "worker stopped right after launch: " + worker.describe();
      }
      if (System.nanoTime() >= deadline) {
        return worker.running() ? null : "worker not running after " + timeout + ": " + worker.describe();
      }
      if (!pause(Duration.ofMillis(pollMillis))) {
        return "interrupted while waiting for worker to start";
      }
    }
  }

  private String captureDiagnostics(String feed, String runtimeId, String reason) {
    String tail;
    try {
      tail = runtime.recentLogs(runtimeId, DIAGNOSTIC_LINES);
    } catch (RuntimeException e) {
      tail = "<logs unavailable: " + e.getMessage() + ">";
    }
    log.error("feed {}: {}; last output of worker {}:\n{}", feed, reason, runtimeId, tail);
    Path logsDir = properties.getLogsDir();
    if (logsDir != null) {
      Path file = logsDir.resolve(feed + "_" + DIAGNOSTICS_STAMP.format(clock.instant()) + ".log");
      String content = "feed: " + feed + "\nworker: " + runtimeId + "\nreason: " + reason + "\n\n" + tail;
      try {
        Files.createDirectories(logsDir);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        log.info("feed {}: diagnostics written to {}", feed, file);
      } catch (IOException e) {
        log.warn("feed {}: unable to write diagnostics to {}: {}", feed, file, e.getMessage());
      }
    }
    return tail;
  }

  private static boolean pause(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static String shortHash(String hash) {
    return hash.length() > 12 ? hash.substring(0, 12) : hash;
  }
}
