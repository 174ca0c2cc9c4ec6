package io.feedhive.feedcontroller.runtime;

public interface RuntimeEventListener {

  void onEvent(RuntimeEvent event);

  /**
   * The event stream ended.
   *
   * @param cause the failure that ended it, or {@code null} when the runtime closed it
   */
  void onClosed(Throwable cause);
}
