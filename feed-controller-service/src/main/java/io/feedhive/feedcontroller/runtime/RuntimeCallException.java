package io.feedhive.feedcontroller.runtime;

/**
 * A call into the container runtime failed.
 */
public class RuntimeCallException extends RuntimeException {

  public RuntimeCallException(String message, Throwable cause) {
    super(message, cause);
  }

  public RuntimeCallException(String message) {
    super(message);
  }
}
