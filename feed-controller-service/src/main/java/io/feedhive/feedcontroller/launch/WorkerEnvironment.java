package io.feedhive.feedcontroller.launch;

import io.feedhive.feed.model.FeedSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a {@link FeedSpec} to the environment the harvesting worker reads.
 * <p>
 * Every variable is always present except {@code BEFORE}, {@code AFTER}, {@code ACCESS_TOKEN}
 * and {@code PERF_NAME}, which are only set when configured. Polling intervals are configured in
 * seconds and passed in milliseconds; query timeouts are passed in seconds.
 */
public class WorkerEnvironment {

  private static final Logger log = LoggerFactory.getLogger(WorkerEnvironment.class);

  static final String OPERATION_MODE = "Sync";
  static final int MEMBER_BATCH_SIZE = 500;

  /**
   * Variables custom environment entries may not override.
   */
  public static final Set<String> RESERVED = Set.of(
      "LDES", "SPARQL_ENDPOINT", "TARGET_GRAPH", "FAILURE_IS_FATAL", "FOLLOW", "POLLING_FREQUENCY");

  private static final Set<String> SECRET = Set.of("ACCESS_TOKEN");

  private final String workerLogLevel;

  public WorkerEnvironment(String workerLogLevel) {
    this.workerLogLevel = Objects.requireNonNull(workerLogLevel, "workerLogLevel").toLowerCase(Locale.ROOT);
  }

  public Map<String, String> build(FeedSpec spec) {
    Map<String, String> env = new LinkedHashMap<>();
    env.put("LDES", spec.sourceUrl());
    env.put("SPARQL_ENDPOINT", spec.targetEndpoint());
    env.put("TARGET_GRAPH", spec.targetGraph());
    env.put("SHAPE", spec.shape());
    env.put("FOLLOW", Boolean.toString(spec.follow()));
    env.put("MATERIALIZE", Boolean.toString(spec.materialize()));
    env.put("ORDER", spec.order().token());
    env.put("LAST_VERSION_ONLY", Boolean.toString(spec.lastVersionOnly()));
    env.put("FAILURE_IS_FATAL", Boolean.toString(spec.failureIsFatal()));
    env.put("POLLING_FREQUENCY", Long.toString(spec.pollingInterval().toMillis()));
    env.put("CONCURRENT_FETCHES", Integer.toString(spec.concurrentFetches()));
    env.put("FOR_VIRTUOSO", Boolean.toString(spec.forVirtuoso()));
    env.put("QUERY_TIMEOUT", Long.toString(spec.queryTimeout().toSeconds()));
    putIfPresent(env, "BEFORE", spec.before());
    putIfPresent(env, "AFTER", spec.after());
    putIfPresent(env, "ACCESS_TOKEN", spec.accessToken());
    putIfPresent(env, "PERF_NAME", spec.perfName());
    env.put("LOG_LEVEL", workerLogLevel);
    env.put("OPERATION_MODE", OPERATION_MODE);
    env.put("MEMBER_BATCH_SIZE", Integer.toString(MEMBER_BATCH_SIZE));
    spec.environment().forEach((key, value) -> {
      if (RESERVED.contains(key)) {
        log.warn("feed {}: ignoring environment override of reserved variable {}", spec.name(), key);
      } else {
        env.put(key, value);
      }
    });
    return Collections.unmodifiableMap(env);
  }

  /**
   * Printable form of an environment with secrets masked.
   */
  public static String describe(Map<String, String> env) {
    return env.entrySet().stream()
        .map(e -> e.getKey() + "=" + (SECRET.contains(e.getKey()) ? "****" : e.getValue()))
        .collect(Collectors.joining(", ", "{", "}"));
  }

  private static void putIfPresent(Map<String, String> env, String key, String value) {
    if (value != null && !value.isBlank()) {
      env.put(key, value);
    }
  }
}
