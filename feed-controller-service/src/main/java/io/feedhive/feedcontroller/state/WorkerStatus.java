package io.feedhive.feedcontroller.state;

public enum WorkerStatus {
  LAUNCHING,
  RUNNING,
  DEGRADED,
  STOPPING,
  ABSENT
}
