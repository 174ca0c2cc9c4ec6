package io.feedhive.feedcontroller.lock;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether the process named in a lock record is still alive.
 */
@FunctionalInterface
public interface HolderLiveness {

  boolean isAlive(LockRecord record);

  /**
   * Probes processes on this host with {@link ProcessHandle}; holders on other hosts cannot be
   * probed and are assumed alive.
   * <p>
   * A pid is only trusted together with its start instant: a controller restarted in the same
   * container usually gets the pid of the crashed one, and its record is then stale.
   */
  static HolderLiveness localProcesses(String localHost) {
    return record -> {
      if (!Objects.equals(localHost, record.host())) {
        return true;
      }
      Optional<ProcessHandle> process = ProcessHandle.of(record.pid());
      if (process.isEmpty() || !process.get().isAlive()) {
        return false;
      }
      String started = LockRecord.startOf(process.get());
      if (record.processStart() == null || started == null) {
        // without start instants only a foreign pid can be trusted
        return record.pid() != ProcessHandle.current().pid();
      }
      return record.processStart().equals(started);
    };
  }
}
