package io.feedhive.feedcontroller.state;

import java.time.Instant;
import java.util.Objects;

/**
 * The controller's record of the worker serving one feed.
 *
 * @param runtimeId runtime id of the worker container; {@code null} while launching and for a
 *                  degraded feed whose failed container was removed
 * @param specHash  content hash of the {@code FeedSpec} the worker was launched from
 */
public record WorkerHandle(String feedName, String runtimeId, String specHash, WorkerStatus status, Instant startedAt) {

  public WorkerHandle {
    Objects.requireNonNull(feedName, "feedName");
    Objects.requireNonNull(specHash, "specHash");
    Objects.requireNonNull(status, "status");
  }

  public WorkerHandle withStatus(WorkerStatus next) {
    return new WorkerHandle(feedName, runtimeId, specHash, next, startedAt);
  }

  public boolean hasRuntime() {
    return runtimeId != null;
  }
}
