package io.feedhive.feedcontroller.source;

import io.feedhive.feed.model.FeedSpec;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Source of feed definitions: a full initial load plus a stream of subsequent changes.
 * <p>
 * Invalid entries never reach callers; they are logged and excluded.
 */
public interface FeedConfigSource {

  /**
   * Load every valid entry, replacing whatever the source knew before.
   */
  Set<FeedSpec> scan();

  /**
   * Deliver changes relative to the last scan to {@code sink} until the returned handle is
   * closed. May be called again after closing.
   */
  AutoCloseable watch(Consumer<ChangeEvent> sink);
}
