package io.feedhive.feedcontroller.lock;

/**
 * The controller could not become the single owner of its configuration root. Not recoverable.
 */
public class LockAcquisitionException extends RuntimeException {

  public LockAcquisitionException(String message) {
    super(message);
  }

  public LockAcquisitionException(String message, Throwable cause) {
    super(message, cause);
  }
}
