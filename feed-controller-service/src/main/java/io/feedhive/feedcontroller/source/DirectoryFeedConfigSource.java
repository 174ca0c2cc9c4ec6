package io.feedhive.feedcontroller.source;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import io.feedhive.feed.model.FeedConfigException;
import io.feedhive.feed.model.FeedNames;
import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feed.model.FeedSpecParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeedConfigSource} over a directory holding one YAML file per feed.
 * <p>
 * Filesystem notifications are debounced per file: a burst of notifications for the same file
 * yields one refresh, parsed from the file's final content. The directory is also rescanned on a
 * fixed interval and whenever the notification queue overflows, so the source converges even
 * on filesystems that never deliver notifications.
 */
public class DirectoryFeedConfigSource implements FeedConfigSource {

  private static final Logger log = LoggerFactory.getLogger(DirectoryFeedConfigSource.class);

  private final Path root;
  private final FeedSpecParser parser;
  private final Duration debounce;
  private final Duration rescanInterval;

  private final Map<Path, Entry> entries = new HashMap<>();
  private final Map<Path, String> rejected = new HashMap<>();
  private final Map<Path, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

  private WatchService watchService;
  private Thread watchThread;
  private ScheduledExecutorService scheduler;
  private volatile Consumer<ChangeEvent> sink;

  public DirectoryFeedConfigSource(Path root, FeedSpecParser parser, Duration debounce, Duration rescanInterval) {
    this.root = Objects.requireNonNull(root, "root");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.debounce = Objects.requireNonNull(debounce, "debounce");
    this.rescanInterval = Objects.requireNonNull(rescanInterval, "rescanInterval");
  }

  @Override
  public synchronized Set<FeedSpec> scan() {
    ensureRoot();
    entries.clear();
    rejected.clear();
    for (Path file : listFeedFiles()) {
      refresh(file);
    }
    Set<FeedSpec> specs = new LinkedHashSet<>();
    entries.values().forEach(entry -> specs.add(entry.spec()));
    log.info("loaded {} feed(s) from {}", specs.size(), root);
    return Collections.unmodifiableSet(specs);
  }

  @Override
  public synchronized AutoCloseable watch(Consumer<ChangeEvent> sink) {
    Objects.requireNonNull(sink, "sink");
    if (watchService != null) {
      throw new IllegalStateException("already watching " + root);
    }
    ensureRoot();
    WatchService service;
    try {
      service = root.getFileSystem().newWatchService();
      root.register(service, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to watch " + root, e);
    }
    this.sink = sink;
    this.watchService = service;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "feed-config-refresh");
        thread.setDaemon(true);
        return thread;
      }
    });
    long rescanMs = Math.max(rescanInterval.toMillis(), 100L);
    scheduler.scheduleWithFixedDelay(this::rescan, rescanMs, rescanMs, TimeUnit.MILLISECONDS);
    watchThread = new Thread(() -> watchLoop(service), "feed-config-watch");
    watchThread.setDaemon(true);
    watchThread.start();
    log.info("watching {} for feed changes (debounce {}, rescan every {})", root, debounce, rescanInterval);
    return this::stopWatching;
  }

  /**
   * Record a filesystem notification for {@code file}; the refresh runs once the file has been
   * quiet for the debounce interval.
   */
  void notifyChanged(Path file) {
    ScheduledExecutorService executor = scheduler;
    if (executor == null || executor.isShutdown()) {
      return;
    }
    pending.compute(file, (path, previous) -> {
      if (previous != null) {
        previous.cancel(false);
      }
      return executor.schedule(() -> refreshPending(path), debounce.toMillis(), TimeUnit.MILLISECONDS);
    });
  }

  /**
   * Compare the directory against what is known and emit the differences.
   */
  void rescan() {
    try {
      Set<Path> candidates = new TreeSet<>(listFeedFiles());
      synchronized (this) {
        candidates.addAll(entries.keySet());
      }
      for (Path file : candidates) {
        if (!pending.containsKey(file)) {
          emit(refreshLocked(file));
        }
      }
    } catch (RuntimeException e) {
      log.error("rescan of {} failed", root, e);
    }
  }

  private void refreshPending(Path file) {
    pending.remove(file);
    try {
      emit(refreshLocked(file));
    } catch (RuntimeException e) {
      log.error("refresh of {} failed", file, e);
    }
  }

  synchronized List<ChangeEvent> refreshLocked(Path file) {
    return refresh(file);
  }

  private List<ChangeEvent> refresh(Path file) {
    Entry previous = entries.get(file);
    FeedSpec parsed = null;
    String failure = null;
    if (Files.isRegularFile(file) && FeedNames.isFeedFile(file)) {
      try {
        parsed = parser.parse(file);
      } catch (FeedConfigException e) {
        failure = e.getMessage();
      }
      if (parsed != null) {
        Path owner = ownerOf(parsed.name());
        if (owner != null && !owner.equals(file) && !Files.exists(owner)) {
          // the declaring file is gone but its removal has not been processed yet: the feed moved here
          Entry moved = entries.remove(owner);
          rejected.remove(owner);
          if (previous == null) {
            previous = moved;
          }
        } else if (owner != null && !owner.equals(file)) {
          failure = file.getFileName() + ": feed name '" + parsed.name() + "' is already declared by "
              + owner.getFileName();
          parsed = null;
        }
      }
    }
    reportRejection(file, failure);

    List<ChangeEvent> events = new ArrayList<>(2);
    if (parsed == null) {
      if (previous != null) {
        entries.remove(file);
        events.add(ChangeEvent.removed(previous.name(), failure != null ? "invalid configuration" : "file removed"));
      }
      return events;
    }
    Entry next = new Entry(parsed.name(), parsed.contentHash(), parsed);
    entries.put(file, next);
    if (previous == null) {
      events.add(ChangeEvent.added(parsed));
    } else if (!previous.name().equals(next.name())) {
      events.add(ChangeEvent.removed(previous.name(), "renamed to " + next.name()));
      events.add(ChangeEvent.added(parsed));
    } else if (!previous.hash().equals(next.hash())) {
      events.add(ChangeEvent.modified(parsed));
    }
    return events;
  }

  private void reportRejection(Path file, String failure) {
    if (failure == null) {
      rejected.remove(file);
      return;
    }
    String previous = rejected.put(file, failure);
    if (!failure.equals(previous)) {
      log.error("excluding feed configuration {}", failure);
    }
  }

  private Path ownerOf(String name) {
    for (Map.Entry<Path, Entry> entry : entries.entrySet()) {
      if (entry.getValue().name().equals(name)) {
        return entry.getKey();
      }
    }
    return null;
  }

  private void emit(List<ChangeEvent> events) {
    Consumer<ChangeEvent> target = sink;
    for (ChangeEvent event : events) {
      log.info("feed {} {} ({})", event.name(), event.kind().name().toLowerCase(Locale.ROOT), event.reason());
      if (target != null) {
        target.accept(event);
      }
    }
  }

  private void watchLoop(WatchService service) {
    while (true) {
      WatchKey key;
      try {
        key = service.take();
      } catch (ClosedWatchServiceException e) {
        return;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      for (WatchEvent<?> event : key.pollEvents()) {
        if (event.kind() == OVERFLOW) {
          log.warn("filesystem notifications for {} overflowed; rescanning", root);
          ScheduledExecutorService executor = scheduler;
          if (executor != null && !executor.isShutdown()) {
            executor.execute(this::rescan);
          }
          continue;
        }
        Path changed = root.resolve((Path) event.context());
        notifyChanged(changed);
      }
      if (!key.reset()) {
        log.warn("watch on {} is no longer valid; relying on periodic rescans", root);
        return;
      }
    }
  }

  private synchronized void stopWatching() {
    if (watchService == null) {
      return;
    }
    try {
      watchService.close();
    } catch (IOException e) {
      log.warn("unable to close watch service for {}: {}", root, e.getMessage());
    }
    watchThread.interrupt();
    scheduler.shutdownNow();
    pending.clear();
    watchService = null;
    watchThread = null;
    scheduler = null;
    sink = null;
    log.info("stopped watching {}", root);
  }

  private void ensureRoot() {
    if (Files.isDirectory(root)) {
      return;
    }
    try {
      Files.createDirectories(root);
      log.info("created feed configuration directory {}", root);
    } catch (IOException e) {
      throw new UncheckedIOException("unable to create feed configuration directory " + root, e);
    }
  }

  private List<Path> listFeedFiles() {
    try (Stream<Path> files = Files.list(root)) {
      return files.filter(Files::isRegularFile)
          .filter(FeedNames::isFeedFile)
          .sorted()
          .toList();
    } catch (IOException e) {
      log.warn("unable to list {}: {}", root, e.getMessage());
      return List.of();
    }
  }

  private record Entry(String name, String hash, FeedSpec spec) {
  }
}
