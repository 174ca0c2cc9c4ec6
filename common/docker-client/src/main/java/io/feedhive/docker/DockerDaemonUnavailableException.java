package io.feedhive.docker;

/**
 * A Docker call failed because the daemon could not be reached (missing socket, refused
 * connection, unresolvable host). Callers treat it as transient and retry later.
 */
public class DockerDaemonUnavailableException extends RuntimeException {

    private final String action;

    public DockerDaemonUnavailableException(String action, String hint, Throwable cause) {
        super("Unable to " + action + " because the Docker daemon is unavailable. " + hint, cause);
        this.action = action;
    }

    /**
     * The Docker operation that failed, e.g. {@code start container}.
     */
    public String getAction() {
        return action;
    }
}
