package io.feedhive.feedcontroller.runtime;

import java.util.Map;

/**
 * Point-in-time view of one worker as reported by the runtime.
 *
 * @param state    runtime state such as {@code running}, {@code exited} or {@code created}
 * @param health   health check status, or {@code null} when the worker has no health check
 * @param exitCode exit code of a stopped worker, or {@code null}
 */
public record RuntimeWorker(String runtimeId,
                            String name,
                            Map<String, String> labels,
                            String state,
                            String health,
                            Long exitCode) {

  public RuntimeWorker {
    labels = labels == null ? Map.of() : Map.copyOf(labels);
  }

  public boolean running() {
    return "running".equalsIgnoreCase(state);
  }

  public boolean unhealthy() {
    return "unhealthy".equalsIgnoreCase(health);
  }

  public String label(String key) {
    return labels.get(key);
  }

  public String describe() {
    StringBuilder detail = new StringBuilder(state == null ? "unknown" : state);
    if (exitCode != null) {
      detail.append(" (exit code ").append(exitCode).append(')');
    }
    if (health != null) {
      detail.append(", health ").append(health);
    }
    return detail.toString();
  }
}
