package io.feedhive.feedcontroller;

import static io.feedhive.feedcontroller.config.FeedControllerProperties.FEED_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.GROUP_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.IMAGE_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.SPEC_HASH_LABEL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.feedhive.feed.model.FeedSpecParser;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import io.feedhive.feedcontroller.health.WorkerHealthMonitor;
import io.feedhive.feedcontroller.launch.WorkerEnvironment;
import io.feedhive.feedcontroller.launch.WorkerLauncher;
import io.feedhive.feedcontroller.lock.LockAcquisitionException;
import io.feedhive.feedcontroller.lock.LockManager;
import io.feedhive.feedcontroller.lock.LockRecord;
import io.feedhive.feedcontroller.reconcile.FeedReconciler;
import io.feedhive.feedcontroller.runtime.InMemoryRuntimeClient;
import io.feedhive.feedcontroller.shutdown.ShutdownCoordinator;
import io.feedhive.feedcontroller.source.DirectoryFeedConfigSource;
import io.feedhive.feedcontroller.state.FeedStateStore;
import io.feedhive.feedcontroller.state.WorkerStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeedControllerLifecycleTest {

  private static final String FEED_A = """
      url: https://example.org/ldes/a
      sparql_endpoint: http://virtuoso:8890/sparql
      polling_interval: 60
      """;

  @TempDir
  Path tempDir;

  private final InMemoryRuntimeClient runtime = new InMemoryRuntimeClient();
  private final FeedStateStore store = new FeedStateStore();
  private final ObjectMapper mapper = new ObjectMapper();
  private FeedControllerProperties properties;
  private ShutdownCoordinator coordinator;
  private FeedControllerLifecycle lifecycle;

  @BeforeEach
  void setUp() throws Exception {
    properties = FeedControllerTestProperties.under(tempDir);
    Files.createDirectories(properties.getConfigDir());
    LockManager lockManager = new LockManager(mapper, record -> !record.holderId().equals("crashed"),
        "test-host", Clock.systemUTC());
    WorkerLauncher launcher = new WorkerLauncher(runtime, properties, new WorkerEnvironment("info"),
        Clock.systemUTC(), Duration.ZERO);
    ExecutorService executor = Executors.newCachedThreadPool();
    FeedReconciler reconciler = new FeedReconciler(store, launcher, executor,
        new FeedControllerMetrics(new SimpleMeterRegistry(), store), Clock.systemUTC());
    WorkerHealthMonitor monitor = new WorkerHealthMonitor(runtime, store, reconciler::onWorkerLost,
        properties.groupLabels(), Duration.ofHours(1), Duration.ofMillis(50));
    DirectoryFeedConfigSource source = new DirectoryFeedConfigSource(properties.getConfigDir(),
        new FeedSpecParser(), properties.getTiming().debounce(), properties.getTiming().rescanInterval());
    coordinator = new ShutdownCoordinator(reconciler, lockManager, properties.getTiming().shutdownGrace());
    lifecycle = new FeedControllerLifecycle(properties, "test-host-1", lockManager, source, launcher,
        reconciler, monitor, coordinator, executor);
  }

  @AfterEach
  void tearDown() {
    lifecycle.stop();
  }

  @Test
  void startsConfiguredFeedsAndStopsThemOnShutdown() throws Exception {
    Files.writeString(properties.getConfigDir().resolve("feed-a.yaml"), FEED_A);

    lifecycle.start();

    assertThat(lifecycle.isRunning()).isTrue();
    assertThat(properties.getLock().path()).exists();
    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        assertThat(store.actual("feed-a")).hasValueSatisfying(handle ->
            assertThat(handle.status()).isEqualTo(WorkerStatus.RUNNING)));

    lifecycle.stop();

    assertThat(lifecycle.isRunning()).isFalse();
    assertThat(runtime.running()).isEmpty();
    assertThat(coordinator.getExitCode()).isEqualTo(ShutdownCoordinator.CLEAN);
    assertThat(properties.getLock().path()).doesNotExist();
  }

  @Test
  void picksUpFeedsAddedWhileRunning() throws Exception {
    lifecycle.start();

    Files.writeString(properties.getConfigDir().resolve("feed-a.yaml"), FEED_A);

    await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
        assertThat(runtime.launched()).hasSize(1));
  }

  @Test
  void adoptsMatchingWorkerFromPreviousRun() throws Exception {
    Files.writeString(properties.getConfigDir().resolve("feed-a.yaml"), FEED_A);
    String hash = new FeedSpecParser().parse("feed-a.yaml", FEED_A).contentHash();
    String existing = runtime.seed("ldes-consumer-feed-a", Map.of(
        GROUP_LABEL, FeedControllerTestProperties.GROUP,
        FEED_LABEL, "feed-a",
        SPEC_HASH_LABEL, hash,
        IMAGE_LABEL, FeedControllerTestProperties.IMAGE), "running");

    lifecycle.start();

    await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
        assertThat(store.actual("feed-a")).hasValueSatisfying(handle ->
            assertThat(handle.runtimeId()).isEqualTo(existing)));
    assertThat(runtime.launched()).isEmpty();
  }

  @Test
  void refusesToStartWhileAnotherControllerHoldsTheLock() throws Exception {
    Files.writeString(properties.getConfigDir().resolve("feed-a.yaml"), FEED_A);
    Files.write(properties.getLock().path(),
        mapper.writeValueAsBytes(new LockRecord("other-controller", 4242L, null, "test-host", "2024-05-01T10:00:00Z")));

    assertThatThrownBy(() -> lifecycle.start())
        .isInstanceOf(LockAcquisitionException.class)
        .hasMessageContaining("other-controller");
    assertThat(lifecycle.isRunning()).isFalse();
    assertThat(runtime.launched()).isEmpty();
  }

  @Test
  void reclaimsLockLeftByCrashedController() throws Exception {
    Files.write(properties.getLock().path(),
        mapper.writeValueAsBytes(new LockRecord("crashed", 4242L, null, "test-host", "2024-05-01T10:00:00Z")));

    lifecycle.start();

    assertThat(lifecycle.isRunning()).isTrue();
  }
}
