package io.feedhive.feedcontroller;

import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import io.feedhive.feedcontroller.health.WorkerHealthMonitor;
import io.feedhive.feedcontroller.launch.WorkerLauncher;
import io.feedhive.feedcontroller.lock.LockManager;
import io.feedhive.feedcontroller.lock.LockToken;
import io.feedhive.feedcontroller.reconcile.FeedReconciler;
import io.feedhive.feedcontroller.reconcile.ReconcileEvent;
import io.feedhive.feedcontroller.shutdown.ShutdownCoordinator;
import io.feedhive.feedcontroller.source.FeedConfigSource;
import io.feedhive.feedcontroller.state.WorkerHandle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the controller once the context is up and shuts it down in order when the context closes.
 * <p>
 * Start-up order: acquire the lock, load configuration, adopt or clean up existing workers,
 * reconcile, then start watching for changes and worker deaths.
 */
public class FeedControllerLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(FeedControllerLifecycle.class);

  private final FeedControllerProperties properties;
  private final String instanceId;
  private final LockManager lockManager;
  private final FeedConfigSource configSource;
  private final WorkerLauncher launcher;
  private final FeedReconciler reconciler;
  private final WorkerHealthMonitor healthMonitor;
  private final ShutdownCoordinator shutdownCoordinator;
  private final ExecutorService runtimeExecutor;

  private ScheduledExecutorService ticker;
  private AutoCloseable watch;
  private LockToken lock;
  private volatile boolean running;

  public FeedControllerLifecycle(FeedControllerProperties properties,
                                 String instanceId,
                                 LockManager lockManager,
                                 FeedConfigSource configSource,
                                 WorkerLauncher launcher,
                                 FeedReconciler reconciler,
                                 WorkerHealthMonitor healthMonitor,
                                 ShutdownCoordinator shutdownCoordinator,
                                 ExecutorService runtimeExecutor) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
    this.configSource = Objects.requireNonNull(configSource, "configSource");
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
    this.shutdownCoordinator = Objects.requireNonNull(shutdownCoordinator, "shutdownCoordinator");
    this.runtimeExecutor = Objects.requireNonNull(runtimeExecutor, "runtimeExecutor");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    FeedControllerProperties.Lock lockSettings = properties.getLock();
    lock = lockManager.acquire(lockSettings.path(), instanceId, lockSettings.retries(), lockSettings.backoff());
    log.info("feed controller {} starting (config {}, image {})",
        instanceId, properties.getConfigDir(), properties.getWorker().image());
    try {
      reconciler.start();
      Set<FeedSpec> specs = configSource.scan();
      Map<String, FeedSpec> desired = new LinkedHashMap<>();
      specs.forEach(spec -> desired.put(spec.name(), spec));
      List<WorkerHandle> adopted = launcher.adoptExisting(desired);
      reconciler.submit(new ReconcileEvent.Bootstrap(specs, adopted));
      healthMonitor.start();
      watch = configSource.watch(reconciler::onConfigChange);
    } catch (RuntimeException e) {
      log.error("feed controller failed to start: {}", e.getMessage());
      healthMonitor.close();
      reconciler.stop();
      lockManager.release(lock);
      lock = null;
      throw e;
    }
    ticker = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "feed-reconcile-tick");
        thread.setDaemon(true);
        return thread;
      }
    });
    long periodMs = Math.max(properties.getTiming().reconcileInterval().toMillis(), 100L);
    ticker.scheduleAtFixedRate(reconciler::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
    running = true;
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    ticker.shutdownNow();
    List<AutoCloseable> producers = new ArrayList<>();
    producers.add(watch);
    producers.add(healthMonitor);
    shutdownCoordinator.shutdown(producers, lock);
    runtimeExecutor.shutdownNow();
    lock = null;
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
