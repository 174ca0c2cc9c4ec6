package io.feedhive.feedcontroller.shutdown;

import io.feedhive.feedcontroller.lock.LockManager;
import io.feedhive.feedcontroller.lock.LockToken;
import io.feedhive.feedcontroller.reconcile.FeedReconciler;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Orderly shutdown: stop the producers of change events, let the reconciler stop every worker
 * within a grace period, then give up the controller lock.
 * <p>
 * The resulting exit code is {@value #CLEAN} when every worker stopped in time and
 * {@value #FORCED} (128 + SIGTERM) when shutdown had to proceed without them.
 */
public class ShutdownCoordinator implements ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

  public static final int CLEAN = 0;
  public static final int FORCED = 143;

  private final FeedReconciler reconciler;
  private final LockManager lockManager;
  private final Duration grace;
  private volatile int exitCode = CLEAN;

  public ShutdownCoordinator(FeedReconciler reconciler, LockManager lockManager, Duration grace) {
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
    this.grace = Objects.requireNonNull(grace, "grace");
  }

  /**
   * @param producers event producers to close before draining
   * @param lock      the lock to release last; may be {@code null}
   * @return the exit code
   */
  public int shutdown(List<? extends AutoCloseable> producers, LockToken lock) {
    log.info("shutdown requested; waiting up to {} for workers to stop", grace);
    for (AutoCloseable producer : producers) {
      closeQuietly(producer);
    }
    int code = awaitDrained();
    reconciler.stop();
    if (lock != null) {
      lockManager.release(lock);
    }
    exitCode = code;
    log.info("shutdown complete (exit code {})", code);
    return code;
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private int awaitDrained() {
    try {
      boolean clean = reconciler.requestShutdown().get(grace.toMillis(), TimeUnit.MILLISECONDS);
      if (!clean) {
        log.warn("some workers could not be stopped");
      }
      return clean ? CLEAN : FORCED;
    } catch (TimeoutException e) {
      log.warn("workers still running after {}; forcing shutdown", grace);
      return FORCED;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("interrupted while waiting for workers to stop; forcing shutdown");
      return FORCED;
    } catch (ExecutionException e) {
      log.error("shutdown of workers failed", e.getCause());
      return FORCED;
    }
  }

  private void closeQuietly(AutoCloseable producer) {
    if (producer == null) {
      return;
    }
    try {
      producer.close();
    } catch (Exception e) {
      log.warn("unable to close {}: {}", producer, e.getMessage());
    }
  }
}
