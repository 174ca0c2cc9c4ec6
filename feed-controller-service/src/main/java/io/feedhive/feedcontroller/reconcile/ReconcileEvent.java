package io.feedhive.feedcontroller.reconcile;

import io.feedhive.feed.model.FeedSpec;
import io.feedhive.feedcontroller.health.HealthEvent;
import io.feedhive.feedcontroller.launch.LaunchOutcome;
import io.feedhive.feedcontroller.source.ChangeEvent;
import io.feedhive.feedcontroller.state.WorkerHandle;
import java.util.Collection;
import java.util.List;

/**
 * Everything the reconciler reacts to. Events are processed one at a time in submission order.
 */
public sealed interface ReconcileEvent {

  /**
   * Initial desired state and the workers adopted from a previous controller.
   */
  record Bootstrap(Collection<FeedSpec> specs, List<WorkerHandle> adopted) implements ReconcileEvent {
    public Bootstrap {
      specs = List.copyOf(specs);
      adopted = List.copyOf(adopted);
    }
  }

  record ConfigChanged(ChangeEvent change) implements ReconcileEvent {
  }

  record WorkerLost(HealthEvent health) implements ReconcileEvent {
  }

  /**
   * Periodic retry point for degraded feeds and lost workers.
   */
  record Tick() implements ReconcileEvent {
  }

  record LaunchFinished(String feedName, String specHash, LaunchOutcome outcome) implements ReconcileEvent {
  }

  record StopFinished(String feedName, String runtimeId, boolean stopped) implements ReconcileEvent {
  }

  record ShutdownRequested() implements ReconcileEvent {
  }
}
