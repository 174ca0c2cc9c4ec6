package io.feedhive.feedcontroller.health;

import java.util.Objects;

/**
 * A tracked worker died or stopped reporting healthy.
 */
public record HealthEvent(String feedName, String runtimeId, String detail) {

  public HealthEvent {
    Objects.requireNonNull(feedName, "feedName");
    Objects.requireNonNull(runtimeId, "runtimeId");
  }
}
