package io.feedhive.feedcontroller.reconcile;

import static io.feedhive.feedcontroller.config.FeedControllerProperties.FEED_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.GROUP_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.IMAGE_LABEL;
import static io.feedhive.feedcontroller.config.FeedControllerProperties.SPEC_HASH_LABEL;
import static org.assertj.core.api.Assertions.assertThat;

import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feedcontroller.FeedControllerMetrics;
import io.feedhive.feedcontroller.FeedControllerTestProperties;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import io.feedhive.feedcontroller.health.HealthEvent;
import io.feedhive.feedcontroller.launch.WorkerEnvironment;
import io.feedhive.feedcontroller.launch.WorkerLauncher;
import io.feedhive.feedcontroller.runtime.InMemoryRuntimeClient;
import io.feedhive.feedcontroller.runtime.LaunchSpec;
import io.feedhive.feedcontroller.source.ChangeEvent;
import io.feedhive.feedcontroller.state.FeedStateStore;
import io.feedhive.feedcontroller.state.WorkerHandle;
import io.feedhive.feedcontroller.state.WorkerStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeedReconcilerTest {

  private static final String CONTAINER_A = "ldes-consumer-feed-a";

  @TempDir
  Path tempDir;

  private InMemoryRuntimeClient runtime;
  private FeedStateStore store;
  private SimpleMeterRegistry registry;
  private FeedControllerProperties properties;
  private WorkerLauncher launcher;

  @BeforeEach
  void setUp() {
    runtime = new InMemoryRuntimeClient();
    store = new FeedStateStore();
    registry = new SimpleMeterRegistry();
    properties = FeedControllerTestProperties.under(tempDir);
    launcher = new WorkerLauncher(runtime, properties, new WorkerEnvironment("info"), Clock.systemUTC(),
        Duration.ZERO);
  }

  @Test
  void addedFeedLaunchesOneWorkerWithDefaults() {
    FeedReconciler reconciler = reconciler(Runnable::run);

    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(1);
    LaunchSpec launched = runtime.launched().get(0);
    assertThat(launched.name()).isEqualTo(CONTAINER_A);
    assertThat(launched.environment())
        .containsEntry("LDES", "https://example.org/ldes/a")
        .containsEntry("SPARQL_ENDPOINT", "http://virtuoso:8890/sparql")
        .containsEntry("POLLING_FREQUENCY", "60000");
    WorkerHandle handle = store.actual("feed-a").orElseThrow();
    assertThat(handle.status()).isEqualTo(WorkerStatus.RUNNING);
    assertThat(handle.specHash()).isEqualTo(feedA(60).contentHash());
    assertThat(registry.get("feedhive.worker.launches").tag("outcome", "started").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void modifiedFeedStopsOldWorkerBeforeLaunchingReplacement() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();
    String first = store.actual("feed-a").orElseThrow().runtimeId();

    reconciler.onConfigChange(ChangeEvent.modified(feedA(120)));
    reconciler.drainQueue();

    assertThat(runtime.stopCalls()).containsExactly(first);
    assertThat(runtime.removed()).containsExactly(first);
    assertThat(runtime.launched()).hasSize(2);
    assertThat(runtime.launched().get(1).environment()).containsEntry("POLLING_FREQUENCY", "120000");
    WorkerHandle handle = store.actual("feed-a").orElseThrow();
    assertThat(handle.runtimeId()).isNotEqualTo(first);
    assertThat(handle.specHash()).isEqualTo(feedA(120).contentHash());
    assertThat(runtime.running()).hasSize(1);
  }

  @Test
  void removedFeedIsStoppedOnceAndNotRelaunched() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();

    reconciler.onConfigChange(ChangeEvent.removed("feed-a", "file removed"));
    reconciler.drainQueue();
    reconciler.tick();
    reconciler.tick();
    reconciler.drainQueue();

    assertThat(runtime.stopCalls()).hasSize(1);
    assertThat(runtime.removed()).hasSize(1);
    assertThat(runtime.launched()).hasSize(1);
    assertThat(store.actualSnapshot()).isEmpty();
  }

  @Test
  void settledStateIssuesNoFurtherCalls() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.onConfigChange(ChangeEvent.added(feed("feed-b")));
    reconciler.drainQueue();

    reconciler.tick();
    reconciler.drainQueue();
    reconciler.tick();
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(2);
    assertThat(runtime.stopCalls()).isEmpty();
    assertThat(store.actualSnapshot().keySet()).containsExactlyInAnyOrderElementsOf(store.desiredSnapshot().keySet());
  }

  @Test
  void restartAdoptsRunningWorkerWithMatchingSpec() {
    FeedSpec spec = feedA(60);
    String existing = runtime.seed(CONTAINER_A, Map.of(
        GROUP_LABEL, FeedControllerTestProperties.GROUP,
        FEED_LABEL, "feed-a",
        SPEC_HASH_LABEL, spec.contentHash(),
        IMAGE_LABEL, FeedControllerTestProperties.IMAGE), "running");
    FeedReconciler reconciler = reconciler(Runnable::run);

    List<WorkerHandle> adopted = launcher.adoptExisting(Map.of("feed-a", spec));
    reconciler.submit(new ReconcileEvent.Bootstrap(List.of(spec), adopted));
    reconciler.drainQueue();

    assertThat(runtime.launched()).isEmpty();
    WorkerHandle handle = store.actual("feed-a").orElseThrow();
    assertThat(handle.runtimeId()).isEqualTo(existing);
    assertThat(handle.status()).isEqualTo(WorkerStatus.RUNNING);
  }

  @Test
  void lostWorkerIsRelaunchedExactlyOnceOnNextTick() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();
    String first = store.actual("feed-a").orElseThrow().runtimeId();

    runtime.killSilently(first);
    reconciler.onWorkerLost(new HealthEvent("feed-a", first, "die (exit code 137)"));
    reconciler.onWorkerLost(new HealthEvent("feed-a", first, "die (exit code 137)"));
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(1);
    assertThat(store.actual("feed-a")).isEmpty();

    reconciler.tick();
    reconciler.drainQueue();
    reconciler.tick();
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(2);
    assertThat(runtime.removed()).contains(first);
    assertThat(store.actual("feed-a").orElseThrow().status()).isEqualTo(WorkerStatus.RUNNING);
    assertThat(registry.get("feedhive.worker.lost").counter().count()).isEqualTo(1.0);
  }

  @Test
  void fatalFailureSuspendsFeedUntilConfigurationChanges() {
    FeedSpec fatal = FeedSpec.builder("feed-a")
        .sourceUrl("https://example.org/ldes/a")
        .targetEndpoint("http://virtuoso:8890/sparql")
        .failureIsFatal(true)
        .build();
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(fatal));
    reconciler.drainQueue();
    String first = store.actual("feed-a").orElseThrow().runtimeId();

    runtime.killSilently(first);
    reconciler.onWorkerLost(new HealthEvent("feed-a", first, "die (exit code 1)"));
    reconciler.tick();
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(1);
    assertThat(reconciler.suspendedFeeds()).containsExactly("feed-a");

    FeedSpec changed = FeedSpec.builder("feed-a")
        .sourceUrl("https://example.org/ldes/a")
        .targetEndpoint("http://virtuoso:8890/sparql")
        .failureIsFatal(true)
        .concurrentFetches(4)
        .build();
    reconciler.onConfigChange(ChangeEvent.modified(changed));
    reconciler.drainQueue();

    assertThat(reconciler.suspendedFeeds()).isEmpty();
    assertThat(runtime.launched()).hasSize(2);
  }

  @Test
  void failedLaunchDegradesAndRetriesOnlyOnTick() throws IOException {
    runtime.crashOnLaunch(CONTAINER_A);
    FeedReconciler reconciler = reconciler(Runnable::run);

    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();
    reconciler.onConfigChange(ChangeEvent.added(feed("feed-b")));
    reconciler.drainQueue();

    assertThat(store.actual("feed-a").orElseThrow().status()).isEqualTo(WorkerStatus.DEGRADED);
    assertThat(runtime.launched()).extracting(LaunchSpec::name).containsOnlyOnce(CONTAINER_A);
    try (Stream<Path> files = Files.list(properties.getLogsDir())) {
      assertThat(files.map(p -> p.getFileName().toString()))
          .anySatisfy(name -> assertThat(name).startsWith("feed-a_").endsWith(".log"));
    }

    runtime.stopCrashing(CONTAINER_A);
    reconciler.tick();
    reconciler.drainQueue();

    assertThat(store.actual("feed-a").orElseThrow().status()).isEqualTo(WorkerStatus.RUNNING);
    assertThat(runtime.launched()).extracting(LaunchSpec::name).filteredOn(CONTAINER_A::equals).hasSize(2);
  }

  @Test
  void launchSupersededByRemovalIsStoppedInsteadOfCommitted() {
    ManualExecutor executor = new ManualExecutor();
    FeedReconciler reconciler = reconciler(executor);

    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();
    assertThat(store.actual("feed-a").orElseThrow().status()).isEqualTo(WorkerStatus.LAUNCHING);

    reconciler.onConfigChange(ChangeEvent.removed("feed-a", "file removed"));
    reconciler.drainQueue();
    executor.runAll();
    reconciler.drainQueue();
    executor.runAll();
    reconciler.drainQueue();

    assertThat(runtime.launched()).hasSize(1);
    assertThat(runtime.stopCalls()).hasSize(1);
    assertThat(runtime.running()).isEmpty();
    assertThat(store.actualSnapshot()).isEmpty();
  }

  @Test
  void stopThatExhaustsRetriesIsRetriedOnTick() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.drainQueue();

    runtime.failNextStops(2);
    reconciler.onConfigChange(ChangeEvent.removed("feed-a", "file removed"));
    reconciler.drainQueue();

    assertThat(store.actual("feed-a").orElseThrow().status()).isEqualTo(WorkerStatus.DEGRADED);
    assertThat(runtime.stopCalls()).hasSize(2);

    reconciler.tick();
    reconciler.drainQueue();

    assertThat(runtime.stopCalls()).hasSize(3);
    assertThat(store.actualSnapshot()).isEmpty();
    assertThat(runtime.running()).isEmpty();
  }

  @Test
  void shutdownStopsEveryWorkerAndIgnoresLaterConfiguration() {
    FeedReconciler reconciler = reconciler(Runnable::run);
    reconciler.onConfigChange(ChangeEvent.added(feedA(60)));
    reconciler.onConfigChange(ChangeEvent.added(feed("feed-b")));
    reconciler.drainQueue();

    CompletableFuture<Boolean> drained = reconciler.requestShutdown();
    reconciler.onConfigChange(ChangeEvent.added(feed("feed-c")));
    reconciler.drainQueue();

    assertThat(drained).isCompletedWithValue(true);
    assertThat(runtime.stopCalls()).hasSize(2);
    assertThat(runtime.launched()).hasSize(2);
    assertThat(runtime.running()).isEmpty();
  }

  private FeedReconciler reconciler(Executor executor) {
    return new FeedReconciler(store, launcher, executor, new FeedControllerMetrics(registry, store),
        Clock.systemUTC());
  }

  private static FeedSpec feedA(long pollingSeconds) {
    return FeedSpec.builder("feed-a")
        .sourceUrl("https://example.org/ldes/a")
        .targetEndpoint("http://virtuoso:8890/sparql")
        .pollingInterval(Duration.ofSeconds(pollingSeconds))
        .build();
  }

  private static FeedSpec feed(String name) {
    return FeedSpec.builder(name)
        .sourceUrl("https://example.org/ldes/" + name)
        .targetEndpoint("http://virtuoso:8890/sparql")
        .build();
  }

  private static final class ManualExecutor implements Executor {
    private final List<Runnable> tasks = new ArrayList<>();

    @Override
    public void execute(Runnable command) {
      tasks.add(command);
    }

    void runAll() {
      List<Runnable> batch = new ArrayList<>(tasks);
      tasks.clear();
      batch.forEach(Runnable::run);
    }
  }
}
