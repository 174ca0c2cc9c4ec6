package io.feedhive.feedcontroller.runtime;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle event for one worker.
 *
 * @param action runtime action, e.g. {@code die}, {@code oom} or {@code health_status: unhealthy}
 */
public record RuntimeEvent(String runtimeId, String name, String action, String detail) {

  private static final Set<String> TERMINAL_ACTIONS = Set.of("die", "stop", "kill", "oom");

  /**
   * Whether the event means the worker is gone or no longer healthy.
   */
  public boolean signalsLoss() {
    if (action == null) {
      return false;
    }
    String normalized = action.toLowerCase(Locale.ROOT).trim();
    return TERMINAL_ACTIONS.contains(normalized) || normalized.equals("health_status: unhealthy");
  }
}
