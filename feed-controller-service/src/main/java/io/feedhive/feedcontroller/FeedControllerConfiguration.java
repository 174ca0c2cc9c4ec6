package io.feedhive.feedcontroller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.feedhive.docker.DockerContainerClient;
import io.feedhive.feed.model.FeedSpecParser;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import io.feedhive.feedcontroller.health.WorkerHealthMonitor;
import io.feedhive.feedcontroller.infra.docker.DockerRuntimeClient;
import io.feedhive.feedcontroller.launch.WorkerEnvironment;
import io.feedhive.feedcontroller.launch.WorkerLauncher;
import io.feedhive.feedcontroller.lock.HolderLiveness;
import io.feedhive.feedcontroller.lock.LockManager;
import io.feedhive.feedcontroller.reconcile.FeedReconciler;
import io.feedhive.feedcontroller.runtime.RuntimeClient;
import io.feedhive.feedcontroller.shutdown.ShutdownCoordinator;
import io.feedhive.feedcontroller.source.DirectoryFeedConfigSource;
import io.feedhive.feedcontroller.source.FeedConfigSource;
import io.feedhive.feedcontroller.state.FeedStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FeedControllerConfiguration {

  private static final Logger log = LoggerFactory.getLogger(FeedControllerConfiguration.class);
  private static final Duration RESUBSCRIBE_DELAY = Duration.ofSeconds(5);

  private final FeedControllerProperties properties;

  public FeedControllerConfiguration(FeedControllerProperties properties) {
    this.properties = properties;
  }

  @Bean
  public String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      String fallback = System.getenv().getOrDefault("HOSTNAME", "localhost");
      log.warn("unable to resolve local host name ({}); using {}", e.getMessage(), fallback);
      return fallback;
    }
  }

  /** Unique per process incarnation; a restart in the same container may reuse the pid. */
  @Bean
  public String instanceId(@Qualifier("hostName") String hostName) {
    return hostName + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LockManager lockManager(ObjectMapper objectMapper, @Qualifier("hostName") String hostName, Clock clock) {
    return new LockManager(objectMapper, HolderLiveness.localProcesses(hostName), hostName, clock);
  }

  @Bean
  public FeedSpecParser feedSpecParser() {
    return new FeedSpecParser();
  }

  @Bean
  public FeedConfigSource feedConfigSource(FeedSpecParser parser) {
    FeedControllerProperties.Timing timing = properties.getTiming();
    return new DirectoryFeedConfigSource(properties.getConfigDir(), parser, timing.debounce(), timing.rescanInterval());
  }

  @Bean
  public FeedStateStore feedStateStore() {
    return new FeedStateStore();
  }

  @Bean
  public FeedControllerMetrics feedControllerMetrics(MeterRegistry meterRegistry, FeedStateStore store) {
    return new FeedControllerMetrics(meterRegistry, store);
  }

  @Bean
  public RuntimeClient runtimeClient(DockerContainerClient dockerContainerClient) {
    return new DockerRuntimeClient(dockerContainerClient);
  }

  @Bean
  public WorkerLauncher workerLauncher(RuntimeClient runtimeClient, Clock clock) {
    return new WorkerLauncher(runtimeClient, properties, new WorkerEnvironment(properties.getWorker().logLevel()), clock);
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService runtimeExecutor() {
    AtomicInteger counter = new AtomicInteger();
    return Executors.newCachedThreadPool(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "feed-runtime-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  @Bean
  public FeedReconciler feedReconciler(FeedStateStore store,
                                       WorkerLauncher launcher,
                                       ExecutorService runtimeExecutor,
                                       FeedControllerMetrics metrics,
                                       Clock clock) {
    return new FeedReconciler(store, launcher, runtimeExecutor, metrics, clock);
  }

  @Bean
  public WorkerHealthMonitor workerHealthMonitor(RuntimeClient runtimeClient,
                                                 FeedStateStore store,
                                                 FeedReconciler reconciler) {
    return new WorkerHealthMonitor(runtimeClient, store, reconciler::onWorkerLost, properties.groupLabels(),
        properties.getTiming().healthPollInterval(), RESUBSCRIBE_DELAY);
  }

  @Bean
  public ShutdownCoordinator shutdownCoordinator(FeedReconciler reconciler, LockManager lockManager) {
    return new ShutdownCoordinator(reconciler, lockManager, properties.getTiming().shutdownGrace());
  }

  @Bean
  public FeedControllerLifecycle feedControllerLifecycle(@Qualifier("instanceId") String instanceId,
                                                         LockManager lockManager,
                                                         FeedConfigSource configSource,
                                                         WorkerLauncher launcher,
                                                         FeedReconciler reconciler,
                                                         WorkerHealthMonitor healthMonitor,
                                                         ShutdownCoordinator shutdownCoordinator,
                                                         ExecutorService runtimeExecutor) {
    return new FeedControllerLifecycle(properties, instanceId, lockManager, configSource, launcher, reconciler,
        healthMonitor, shutdownCoordinator, runtimeExecutor);
  }
}
