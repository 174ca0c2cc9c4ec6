package io.feedhive.feedcontroller.launch;

/**
 * Result of one launch attempt.
 *
 * @param runtimeId   the worker's runtime id; may be {@code null} for a failed launch whose
 *                    container never existed or was removed
 * @param diagnostics tail of the worker's output captured on failure
 */
public record LaunchOutcome(boolean started, String runtimeId, String reason, String diagnostics) {

  public static LaunchOutcome started(String runtimeId) {
    return new LaunchOutcome(true, runtimeId, null, null);
  }

  public static LaunchOutcome failed(String runtimeId, String reason, String diagnostics) {
    return new LaunchOutcome(false, runtimeId, reason, diagnostics);
  }
}
