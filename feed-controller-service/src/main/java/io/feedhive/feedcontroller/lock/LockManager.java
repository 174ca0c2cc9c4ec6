package io.feedhive.feedcontroller.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-based mutual exclusion between controller instances sharing one configuration root.
 * <p>
 * The lock record is a small JSON document that appears at the lock path in a single atomic step
 * (hard link of a fully written temporary file), so a reader never observes a partial record.
 * A record whose holder is not alive is stale and is reclaimed.
 */
public class LockManager {

  private static final Logger log = LoggerFactory.getLogger(LockManager.class);

  private final ObjectMapper mapper;
  private final HolderLiveness liveness;
  private final String host;
  private final Clock clock;

  public LockManager(ObjectMapper mapper, HolderLiveness liveness, String host, Clock clock) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.liveness = Objects.requireNonNull(liveness, "liveness");
    this.host = Objects.requireNonNull(host, "host");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Acquire the lock at {@code path} for {@code holderId}.
   *
   * @param retries how many more times to try after the first attempt while a live holder owns it
   * @throws LockAcquisitionException if a live holder kept the lock through every retry, or the
   *                                  lock file cannot be written at all
   */
  public LockToken acquire(Path path, String holderId, int retries, Duration backoff) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(holderId, "holderId");
    LockRecord current = null;
    int attempt = 0;
    while (true) {
      Instant now = clock.instant();
      LockRecord mine = LockRecord.forCurrentProcess(holderId, host, now);
      try {
        if (tryCreate(path, mine)) {
          log.info("acquired controller lock {} as {}", path, holderId);
          return new LockToken(path, holderId, now);
        }
      } catch (IOException e) {
        throw new LockAcquisitionException("unable to write lock file " + path + ": " + e.getMessage(), e);
      }

      Optional<LockRecord> holder = read(path);
      if (holder.isEmpty()) {
        log.warn("lock file {} is unreadable; treating it as stale", path);
        deleteIfUnchanged(path, null);
        continue;
      }
      current = holder.get();
      if (!liveness.isAlive(current)) {
        log.warn("reclaiming stale lock {} held by {} (pid {} started {} on {})",
            path, current.holderId(), current.pid(), current.processStart(), current.host());
        deleteIfUnchanged(path, current);
        continue;
      }
      if (attempt >= retries) {
        break;
      }
      attempt++;
      log.info("lock {} is held by {} (pid {} on {}); retry {}/{} in {}",
          path, current.holderId(), current.pid(), current.host(), attempt, retries, backoff);
      sleep(backoff);
    }
    throw new LockAcquisitionException("lock " + path + " is held by live controller "
        + current.holderId() + " (pid " + current.pid() + " on " + current.host() + ")");
  }

  /**
   * Remove the lock record, but only while it still names the token's holder.
   */
  public void release(LockToken token) {
    Objects.requireNonNull(token, "token");
    Optional<LockRecord> holder = read(token.path());
    if (holder.isEmpty()) {
      log.warn("lock {} was already gone on release", token.path());
      return;
    }
    if (!token.holderId().equals(holder.get().holderId())) {
      log.warn("not releasing lock {}: it is now held by {}", token.path(), holder.get().holderId());
      return;
    }
    try {
      Files.deleteIfExists(token.path());
      log.info("released controller lock {}", token.path());
    } catch (IOException e) {
      log.warn("unable to delete lock file {}: {}", token.path(), e.getMessage());
    }
  }

  /**
   * The current lock record at {@code path}, if present and readable.
   */
  public Optional<LockRecord> read(Path path) {
    try {
      byte[] content = Files.readAllBytes(path);
      if (content.length == 0) {
        return Optional.empty();
      }
      LockRecord record = mapper.readValue(content, LockRecord.class);
      return record.holderId() == null ? Optional.empty() : Optional.of(record);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      log.debug("unable to read lock file {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  private boolean tryCreate(Path path, LockRecord record) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    byte[] content = serialize(record);
    Path temp = Files.createTempFile(parent, ".lock-", ".tmp");
    try {
      Files.write(temp, content);
      Files.createLink(path, temp);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    } catch (UnsupportedOperationException e) {
      return createInPlace(path, content);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private boolean createInPlace(Path path, byte[] content) throws IOException {
    try {
      Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    }
  }

  private void deleteIfUnchanged(Path path, LockRecord expected) {
    Optional<LockRecord> again = read(path);
    if (expected != null && again.isPresent() && !expected.equals(again.get())) {
      return;
    }
    if (expected == null && again.isPresent()) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw new LockAcquisitionException("unable to remove stale lock " + path + ": " + e.getMessage(), e);
    }
  }

  private byte[] serialize(LockRecord record) {
    try {
      return mapper.writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("unable to serialize lock record", e);
    }
  }

  private static void sleep(Duration backoff) {
    try {
      Thread.sleep(Math.max(0, backoff.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockAcquisitionException("interrupted while waiting for the controller lock");
    }
  }
}
