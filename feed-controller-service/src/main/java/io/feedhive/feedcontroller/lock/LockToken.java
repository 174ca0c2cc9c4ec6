package io.feedhive.feedcontroller.lock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Proof of controller ownership over one lock path.
 */
public record LockToken(Path path, String holderId, Instant acquiredAt) {

  public LockToken {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(holderId, "holderId");
    Objects.requireNonNull(acquiredAt, "acquiredAt");
  }
}
