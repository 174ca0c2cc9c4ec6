package io.feedhive.feedcontroller.reconcile;

import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feedcontroller.FeedControllerMetrics;
import io.feedhive.feedcontroller.health.HealthEvent;
import io.feedhive.feedcontroller.launch.LaunchOutcome;
import io.feedhive.feedcontroller.launch.WorkerLauncher;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.Bootstrap;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.ConfigChanged;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.LaunchFinished;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.ShutdownRequested;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.StopFinished;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.Tick;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent.WorkerLost;
import io.feedhive.feedcontroller.source.ChangeEvent;
import io.feedhive.feedcontroller.state.FeedStateStore;
import io.feedhive.feedcontroller.state.WorkerHandle;
import io.feedhive.feedcontroller.state.WorkerStatus;
import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives actual workers towards the desired feeds.
 * <p>
 * Producers {@link #submit(ReconcileEvent) submit} events from any thread; a single
 * reconciliation thread consumes them in order and is the only writer of the
 * {@link FeedStateStore}. Launches and stops run on the runtime executor and report back as
 * {@link LaunchFinished} and {@link StopFinished} events. At most one runtime operation is in
 * flight per feed; different feeds proceed concurrently.
 * <p>
 * A worker lost unexpectedly, a failed launch and a failed stop are retried on the next
 * {@link Tick}, never immediately. A lost worker whose spec sets {@code failure_is_fatal}
 * suspends its feed until the feed's configuration changes or is re-added.
 */
public class FeedReconciler {

  private static final Logger log = LoggerFactory.getLogger(FeedReconciler.class);

  private final FeedStateStore store;
  private final WorkerLauncher launcher;
  private final Executor runtimeExecutor;
  private final FeedControllerMetrics metrics;
  private final Clock clock;
  private final BlockingQueue<ReconcileEvent> queue = new LinkedBlockingQueue<>();
  private final CompletableFuture<Boolean> drained = new CompletableFuture<>();

  // confined to the reconciliation thread
  private final Set<String> inFlight = new HashSet<>();
  private final Set<String> suspended = new HashSet<>();
  private final Set<String> awaitingTick = new HashSet<>();
  private boolean shuttingDown;
  private boolean cleanShutdown = true;

  private volatile boolean running;
  private Thread loop;

  public FeedReconciler(FeedStateStore store,
                        WorkerLauncher launcher,
                        Executor runtimeExecutor,
                        FeedControllerMetrics metrics,
                        Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.runtimeExecutor = Objects.requireNonNull(runtimeExecutor, "runtimeExecutor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public synchronized void start() {
    if (loop != null) {
      return;
    }
    running = true;
    loop = new Thread(this::run, "feed-reconciler");
    // the only non-daemon thread: it keeps the process alive until shutdown
    loop.setDaemon(false);
    loop.start();
    log.info("reconciler started");
  }

  public synchronized void stop() {
    running = false;
    if (loop != null) {
      loop.interrupt();
      loop = null;
    }
  }

  public void submit(ReconcileEvent event) {
    queue.add(Objects.requireNonNull(event, "event"));
  }

  public void onConfigChange(ChangeEvent change) {
    submit(new ConfigChanged(change));
  }

  public void onWorkerLost(HealthEvent health) {
    submit(new WorkerLost(health));
  }

  public void tick() {
    submit(new Tick());
  }

  /**
   * Stop every worker and stop reacting to configuration.
   *
   * @return completes with {@code true} once no worker is left, or {@code false} if some worker
   *         could not be stopped
   */
  public CompletableFuture<Boolean> requestShutdown() {
    submit(new ShutdownRequested());
    return drained;
  }

  /**
   * Process every queued event on the calling thread.
   */
  void drainQueue() {
    ReconcileEvent event;
    while ((event = queue.poll()) != null) {
      process(event);
    }
  }

  Set<String> suspendedFeeds() {
    return Set.copyOf(suspended);
  }

  private void run() {
    while (running) {
      ReconcileEvent event;
      try {
        event = queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      process(event);
    }
  }

  private void process(ReconcileEvent event) {
    try {
      if (event instanceof ConfigChanged configChanged) {
        onConfigChanged(configChanged.change());
      } else if (event instanceof WorkerLost lost) {
        onLost(lost.health());
      } else if (event instanceof Tick) {
        awaitingTick.clear();
        reconcile(true);
      } else if (event instanceof LaunchFinished finished) {
        onLaunchFinished(finished);
      } else if (event instanceof StopFinished finished) {
        onStopFinished(finished);
      } else if (event instanceof Bootstrap bootstrap) {
        onBootstrap(bootstrap);
      } else if (event instanceof ShutdownRequested) {
        onShutdownRequested();
      }
    } catch (RuntimeException e) {
      log.error("reconciliation of {} failed", event, e);
    }
    completeShutdownIfDrained();
  }

  private void onBootstrap(Bootstrap bootstrap) {
    if (shuttingDown) {
      return;
    }
    bootstrap.specs().forEach(store::putDesired);
    bootstrap.adopted().forEach(store::putActual);
    log.info("reconciling {} configured feed(s) with {} adopted worker(s)",
        bootstrap.specs().size(), bootstrap.adopted().size());
    reconcile(false);
  }

  private void onConfigChanged(ChangeEvent change) {
    if (shuttingDown) {
      log.debug("ignoring {} of feed {} during shutdown", change.kind(), change.name());
      return;
    }
    String name = change.name();
    switch (change.kind()) {
      case ADDED, MODIFIED -> store.putDesired(change.spec());
      case REMOVED -> store.removeDesired(name);
    }
    awaitingTick.remove(name);
    if (suspended.remove(name)) {
      log.info("feed {} resumed after configuration {}", name, change.reason());
    }
    reconcile(false);
  }

  private void onLost(HealthEvent health) {
    String name = health.feedName();
    Optional<WorkerHandle> current = store.actual(name);
    if (current.isEmpty()
        || current.get().status() != WorkerStatus.RUNNING
        || !health.runtimeId().equals(current.get().runtimeId())) {
      log.debug("ignoring health event for untracked worker {} of feed {}", health.runtimeId(), name);
      return;
    }
    store.removeActual(name);
    metrics.workerLost();
    log.warn("worker {} for feed {} lost: {}", health.runtimeId(), name, health.detail());
    Optional<FeedSpec> spec = store.desired(name);
    if (spec.isPresent() && spec.get().failureIsFatal()) {
      suspended.add(name);
      metrics.suspended();
      log.error("feed {} suspended: its worker failed and failure_is_fatal is set; "
          + "change or re-add its configuration to resume", name);
    } else if (spec.isPresent()) {
      awaitingTick.add(name);
      log.info("feed {} will be relaunched on the next reconcile tick", name);
    }
    reconcile(false);
  }

  private void onLaunchFinished(LaunchFinished finished) {
    String name = finished.feedName();
    inFlight.remove(name);
    LaunchOutcome outcome = finished.outcome();
    if (outcome.started()) {
      metrics.launchStarted();
      WorkerHandle launched = new WorkerHandle(name, outcome.runtimeId(), finished.specHash(),
          WorkerStatus.RUNNING, clock.instant());
      Optional<FeedSpec> spec = store.desired(name);
      if (shuttingDown || spec.isEmpty() || !spec.get().contentHash().equals(finished.specHash())) {
        log.info("launch of feed {} was superseded; stopping worker {}", name, outcome.runtimeId());
        dispatchStop(launched);
      } else {
        store.putActual(launched);
        log.info("feed {} running in worker {}", name, outcome.runtimeId());
      }
    } else {
      metrics.launchFailed();
      store.putActual(new WorkerHandle(name, outcome.runtimeId(), finished.specHash(),
          WorkerStatus.DEGRADED, null));
      if (shuttingDown) {
        log.warn("feed {}: launch failed during shutdown: {}", name, outcome.reason());
      } else {
        awaitingTick.add(name);
        log.warn("feed {} degraded: {}; retrying on the next reconcile tick", name, outcome.reason());
      }
    }
    reconcile(false);
  }

  private void onStopFinished(StopFinished finished) {
    String name = finished.feedName();
    inFlight.remove(name);
    Optional<WorkerHandle> current = store.actual(name);
    boolean tracked = current.isPresent() && Objects.equals(current.get().runtimeId(), finished.runtimeId());
    if (finished.stopped()) {
      metrics.stopped();
      if (tracked) {
        store.removeActual(name);
      }
    } else {
      metrics.stopFailed();
      if (shuttingDown) {
        cleanShutdown = false;
        if (tracked) {
          store.removeActual(name);
        }
        log.warn("leaving worker {} of feed {} behind", finished.runtimeId(), name);
      } else if (tracked) {
        store.putActual(current.get().withStatus(WorkerStatus.DEGRADED));
        awaitingTick.add(name);
        log.warn("feed {}: worker {} could not be stopped; retrying on the next reconcile tick",
            name, finished.runtimeId());
      }
    }
    reconcile(false);
  }

  private void onShutdownRequested() {
    if (shuttingDown) {
      return;
    }
    shuttingDown = true;
    log.info("shutting down: stopping {} worker(s)", store.actualCount());
    store.clearDesired();
    awaitingTick.clear();
    reconcile(false);
  }

  private void reconcile(boolean tick) {
    Map<String, WorkerHandle> actual = store.actualSnapshot();
    for (WorkerHandle handle : actual.values()) {
      String name = handle.feedName();
      if (inFlight.contains(name) || awaitingTick.contains(name)) {
        continue;
      }
      Optional<FeedSpec> spec = store.desired(name);
      if (spec.isPresent() && spec.get().contentHash().equals(handle.specHash())) {
        continue;
      }
      if (handle.status() != WorkerStatus.RUNNING && handle.status() != WorkerStatus.DEGRADED) {
        continue;
      }
      if (handle.hasRuntime()) {
        log.info("stopping worker {} of feed {}: {}", handle.runtimeId(), name,
            spec.isPresent() ? "configuration changed" : "feed removed");
        dispatchStop(handle);
      } else {
        store.removeActual(name);
      }
    }

    for (FeedSpec spec : store.desiredSnapshot().values()) {
      String name = spec.name();
      if (inFlight.contains(name) || suspended.contains(name) || awaitingTick.contains(name)) {
        continue;
      }
      Optional<WorkerHandle> handle = store.actual(name);
      if (handle.isEmpty()) {
        dispatchLaunch(spec);
      } else if (tick && handle.get().status() == WorkerStatus.DEGRADED
          && handle.get().specHash().equals(spec.contentHash())) {
        log.info("retrying degraded feed {}", name);
        dispatchLaunch(spec);
      }
    }
  }

  private void dispatchLaunch(FeedSpec spec) {
    String name = spec.name();
    String hash = spec.contentHash();
    inFlight.add(name);
    store.putActual(new WorkerHandle(name, null, hash, WorkerStatus.LAUNCHING, clock.instant()));
    try {
      runtimeExecutor.execute(() -> {
        LaunchOutcome outcome;
        try {
          outcome = launcher.launch(spec);
        } catch (RuntimeException e) {
          outcome = LaunchOutcome.failed(null, e.getMessage(), null);
        }
        submit(new LaunchFinished(name, hash, outcome));
      });
    } catch (RejectedExecutionException e) {
      inFlight.remove(name);
      store.removeActual(name);
      log.warn("feed {}: launch rejected: {}", name, e.getMessage());
    }
  }

  private void dispatchStop(WorkerHandle handle) {
    String name = handle.feedName();
    String runtimeId = handle.runtimeId();
    inFlight.add(name);
    store.putActual(handle.withStatus(WorkerStatus.STOPPING));
    try {
      runtimeExecutor.execute(() -> {
        boolean stopped;
        try {
          stopped = launcher.stop(name, runtimeId);
        } catch (RuntimeException e) {
          log.warn("feed {}: stop of worker {} failed: {}", name, runtimeId, e.getMessage());
          stopped = false;
        }
        submit(new StopFinished(name, runtimeId, stopped));
      });
    } catch (RejectedExecutionException e) {
      inFlight.remove(name);
      store.putActual(handle);
      log.warn("feed {}: stop rejected: {}", name, e.getMessage());
    }
  }

  private void completeShutdownIfDrained() {
    if (shuttingDown && inFlight.isEmpty() && store.actualCount() == 0 && !drained.isDone()) {
      log.info("all workers stopped");
      drained.complete(cleanShutdown);
    }
  }
}
