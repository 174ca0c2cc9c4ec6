package io.feedhive.feedcontroller.lock;

import java.time.Instant;

/**
 * On-disk content of a lock file.
 *
 * @param processStart start instant of the holding process, or {@code null} when the platform
 *                     does not report one; tells a live process apart from an earlier one that
 *                     had the same pid
 */
public record LockRecord(String holderId, long pid, String processStart, String host, String acquiredAt) {

  static LockRecord forCurrentProcess(String holderId, String host, Instant acquiredAt) {
    ProcessHandle self = ProcessHandle.current();
    return new LockRecord(holderId, self.pid(), startOf(self), host, acquiredAt.toString());
  }

  static String startOf(ProcessHandle process) {
    return process.info().startInstant().map(Instant::toString).orElse(null);
  }
}
