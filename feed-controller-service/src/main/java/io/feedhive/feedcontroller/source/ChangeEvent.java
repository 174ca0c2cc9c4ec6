package io.feedhive.feedcontroller.source;

import io.feedhive.feed.model.FeedSpec;
import java.util.Objects;

/**
 * One change to the set of configured feeds, keyed by feed name.
 *
 * @param spec   the new spec for {@link Kind#ADDED} and {@link Kind#MODIFIED}; {@code null} for
 *               {@link Kind#REMOVED}
 * @param reason why the change happened, for logging
 */
public record ChangeEvent(Kind kind, String name, FeedSpec spec, String reason) {

  public enum Kind {
    ADDED,
    MODIFIED,
    REMOVED
  }

  public ChangeEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(name, "name");
    if (kind != Kind.REMOVED) {
      Objects.requireNonNull(spec, "spec");
    }
  }

  public static ChangeEvent added(FeedSpec spec) {
    return new ChangeEvent(Kind.ADDED, spec.name(), spec, "added");
  }

  public static ChangeEvent modified(FeedSpec spec) {
    return new ChangeEvent(Kind.MODIFIED, spec.name(), spec, "modified");
  }

  public static ChangeEvent removed(String name, String reason) {
    return new ChangeEvent(Kind.REMOVED, name, null, reason);
  }
}
