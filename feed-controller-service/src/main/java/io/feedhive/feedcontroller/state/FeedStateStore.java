package io.feedhive.feedcontroller.state;

import io.feedhive.feed.model.FeedSpec;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Desired feeds (name to spec) and actual workers (name to handle).
 * <p>
 * Only the reconciler writes. Other components read snapshots.
 */
public class FeedStateStore {

  private final Map<String, FeedSpec> desired = new ConcurrentHashMap<>();
  private final Map<String, WorkerHandle> actual = new ConcurrentHashMap<>();

  public Optional<FeedSpec> desired(String name) {
    return Optional.ofNullable(desired.get(name));
  }

  public void putDesired(FeedSpec spec) {
    desired.put(spec.name(), spec);
  }

  public void removeDesired(String name) {
    desired.remove(name);
  }

  public void clearDesired() {
    desired.clear();
  }

  public Optional<WorkerHandle> actual(String name) {
    return Optional.ofNullable(actual.get(name));
  }

  public void putActual(WorkerHandle handle) {
    if (handle.status() == WorkerStatus.ABSENT) {
      actual.remove(handle.feedName());
    } else {
      actual.put(handle.feedName(), handle);
    }
  }

  public void removeActual(String name) {
    actual.remove(name);
  }

  /**
   * Sorted copy of the desired map.
   */
  public Map<String, FeedSpec> desiredSnapshot() {
    return new TreeMap<>(desired);
  }

  /**
   * Sorted copy of the actual map.
   */
  public Map<String, WorkerHandle> actualSnapshot() {
    return new TreeMap<>(actual);
  }

  public int desiredCount() {
    return desired.size();
  }

  public int actualCount() {
    return actual.size();
  }
}
