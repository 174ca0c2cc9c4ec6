package io.feedhive.feedcontroller.runtime;

import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stateless capability over the container runtime that hosts feed workers.
 * <p>
 * Implementations perform I/O only; every policy decision (what to launch, when to retry) belongs
 * to the caller. Failures surface as {@link RuntimeCallException}.
 */
public interface RuntimeClient {

  /**
   * Create and start a worker, returning its runtime id.
   */
  String launch(LaunchSpec spec);

  /**
   * Stop a worker. Stopping one that is already stopped or gone succeeds.
   */
  void stop(String runtimeId, Duration timeout);

  /**
   * Remove a stopped worker. Removing one that is already gone succeeds.
   */
  void remove(String runtimeId);

  Optional<RuntimeWorker> inspect(String runtimeId);

  /**
   * Every worker, running or not, carrying all of the given labels.
   */
  List<RuntimeWorker> list(Map<String, String> labelFilter);

  /**
   * Subscribe to lifecycle events of workers carrying all of the given labels. The listener's
   * {@link RuntimeEventListener#onClosed(Throwable)} is called once when the stream ends for any
   * reason other than closing the returned handle.
   */
  Closeable subscribe(Map<String, String> labelFilter, RuntimeEventListener listener);

  /**
   * Up to {@code lines} of the worker's most recent output; empty when none is available.
   */
  String recentLogs(String runtimeId, int lines);

  /**
   * Network workers attach to. A blank {@code configured} value asks the runtime to detect one.
   */
  default String resolveNetwork(String configured) {
    return configured;
  }
}
