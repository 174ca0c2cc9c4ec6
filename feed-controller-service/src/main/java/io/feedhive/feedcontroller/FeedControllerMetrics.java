package io.feedhive.feedcontroller;

import io.feedhive.feedcontroller.state.FeedStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;

/**
 * Micrometer meters for the feed controller.
 */
public class FeedControllerMetrics {

  private final Counter launchesStarted;
  private final Counter launchesFailed;
  private final Counter stops;
  private final Counter stopFailures;
  private final Counter workersLost;
  private final Counter suspensions;

  public FeedControllerMetrics(MeterRegistry registry, FeedStateStore store) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(store, "store");
    this.launchesStarted = Counter.builder("feedhive.worker.launches")
        .tag("outcome", "started")
        .register(registry);
    this.launchesFailed = Counter.builder("feedhive.worker.launches")
        .tag("outcome", "failed")
        .register(registry);
    this.stops = Counter.builder("feedhive.worker.stops")
        .tag("outcome", "stopped")
        .register(registry);
    this.stopFailures = Counter.builder("feedhive.worker.stops")
        .tag("outcome", "failed")
        .register(registry);
    this.workersLost = Counter.builder("feedhive.worker.lost").register(registry);
    this.suspensions = Counter.builder("feedhive.feed.suspensions").register(registry);
    Gauge.builder("feedhive.feeds.desired", store, FeedStateStore::desiredCount).register(registry);
    Gauge.builder("feedhive.feeds.actual", store, FeedStateStore::actualCount).register(registry);
  }

  public void launchStarted() {
    launchesStarted.increment();
  }

  public void launchFailed() {
    launchesFailed.increment();
  }

  public void stopped() {
    stops.increment();
  }

  public void stopFailed() {
    stopFailures.increment();
  }

  public void workerLost() {
    workersLost.increment();
  }

  public void suspended() {
    suspensions.increment();
  }
}
