package io.feedhive.feedcontroller.health;

import io.feedhive.feedcontroller.runtime.RuntimeClient;
import io.feedhive.feedcontroller.runtime.RuntimeEvent;
import io.feedhive.feedcontroller.runtime.RuntimeEventListener;
import io.feedhive.feedcontroller.runtime.RuntimeWorker;
import io.feedhive.feedcontroller.state.FeedStateStore;
import io.feedhive.feedcontroller.state.WorkerHandle;
import io.feedhive.feedcontroller.state.WorkerStatus;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches running workers and reports the ones that die.
 * <p>
 * The runtime's event stream is the primary signal. A fixed-interval poll of every running
 * worker catches whatever the stream misses, and the stream is re-subscribed whenever it ends.
 * Reports may be duplicated; the reconciler ignores reports about workers it no longer tracks.
 */
public class WorkerHealthMonitor implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(WorkerHealthMonitor.class);

  private final RuntimeClient runtime;
  private final FeedStateStore store;
  private final Consumer<HealthEvent> sink;
  private final Map<String, String> labelFilter;
  private final Duration pollInterval;
  private final Duration resubscribeDelay;

  private ScheduledExecutorService scheduler;
  private volatile Closeable subscription;
  private volatile boolean closed = true;

  public WorkerHealthMonitor(RuntimeClient runtime,
                             FeedStateStore store,
                             Consumer<HealthEvent> sink,
                             Map<String, String> labelFilter,
                             Duration pollInterval,
                             Duration resubscribeDelay) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.store = Objects.requireNonNull(store, "store");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.labelFilter = Map.copyOf(labelFilter);
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    this.resubscribeDelay = Objects.requireNonNull(resubscribeDelay, "resubscribeDelay");
  }

  public synchronized void start() {
    if (!closed) {
      return;
    }
    closed = false;
    scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "worker-health");
        thread.setDaemon(true);
        return thread;
      }
    });
    subscribe();
    long periodMs = Math.max(pollInterval.toMillis(), 50L);
    scheduler.scheduleWithFixedDelay(this::poll, periodMs, periodMs, TimeUnit.MILLISECONDS);
    log.info("health monitor started (poll every {})", pollInterval);
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    closeSubscription();
    scheduler.shutdownNow();
    log.info("health monitor stopped");
  }

  /**
   * Inspect every running worker and report those that are no longer running or healthy.
   */
  void poll() {
    for (WorkerHandle handle : store.actualSnapshot().values()) {
      if (closed) {
        return;
      }
      if (handle.status() != WorkerStatus.RUNNING || !handle.hasRuntime()) {
        continue;
      }
      Optional<RuntimeWorker> probe;
      try {
        probe = runtime.inspect(handle.runtimeId());
      } catch (RuntimeException e) {
        log.warn("health poll of worker {} for feed {} failed: {}",
            handle.runtimeId(), handle.feedName(), e.getMessage());
        continue;
      }
      if (probe.isEmpty()) {
        report(handle, "worker no longer exists");
      } else if (!probe.get().running() || probe.get().unhealthy()) {
        report(handle, "worker is " + probe.get().describe());
      }
    }
  }

  void onEvent(RuntimeEvent event) {
    if (!event.signalsLoss() || event.runtimeId() == null) {
      return;
    }
    for (WorkerHandle handle : store.actualSnapshot().values()) {
      if (handle.status() == WorkerStatus.RUNNING && event.runtimeId().equals(handle.runtimeId())) {
        report(handle, event.detail());
        return;
      }
    }
  }

  private void report(WorkerHandle handle, String detail) {
    log.info("worker {} for feed {} reported lost: {}", handle.runtimeId(), handle.feedName(), detail);
    sink.accept(new HealthEvent(handle.feedName(), handle.runtimeId(), detail));
  }

  private void subscribe() {
    if (closed) {
      return;
    }
    try {
      subscription = runtime.subscribe(labelFilter, new RuntimeEventListener() {
        @Override
        public void onEvent(RuntimeEvent event) {
          WorkerHealthMonitor.this.onEvent(event);
        }

        @Override
        public void onClosed(Throwable cause) {
          onStreamClosed(cause);
        }
      });
      log.debug("subscribed to worker events for {}", labelFilter);
    } catch (RuntimeException e) {
      log.warn("unable to subscribe to worker events ({}); polling only until the next attempt in {}",
          e.getMessage(), resubscribeDelay);
      scheduleResubscribe();
    }
  }

  private void onStreamClosed(Throwable cause) {
    if (closed) {
      return;
    }
    if (cause != null) {
      log.warn("worker event stream failed: {}; re-subscribing in {}", cause.getMessage(), resubscribeDelay);
    } else {
      log.info("worker event stream ended; re-subscribing in {}", resubscribeDelay);
    }
    scheduleResubscribe();
  }

  private void scheduleResubscribe() {
    ScheduledExecutorService executor = scheduler;
    if (closed || executor == null || executor.isShutdown()) {
      return;
    }
    executor.schedule(() -> {
      poll();
      subscribe();
    }, resubscribeDelay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void closeSubscription() {
    Closeable current = subscription;
    subscription = null;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (IOException e) {
      log.warn("unable to close worker event subscription: {}", e.getMessage());
    }
  }
}
