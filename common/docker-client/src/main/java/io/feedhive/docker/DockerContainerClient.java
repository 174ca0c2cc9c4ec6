package io.feedhive.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Event;
import com.github.dockerjava.api.model.EventType;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin facade over docker-java used by the feed controller.
 * <p>
 * Every call is translated so that an unreachable daemon surfaces as
 * {@link DockerDaemonUnavailableException}; other failures propagate unchanged.
 */
public class DockerContainerClient {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerClient.class);

    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";

    private final DockerClient dockerClient;

    public DockerContainerClient(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    public String createAndStartContainer(String image,
                                          Map<String, String> env,
                                          String containerName,
                                          Map<String, String> labels,
                                          UnaryOperator<HostConfig> hostConfigCustomizer) {
        String id = createContainer(image, env, containerName, labels, hostConfigCustomizer);
        startContainer(id);
        return id;
    }

    public String createContainer(String image,
                                  Map<String, String> env,
                                  String containerName,
                                  Map<String, String> labels,
                                  UnaryOperator<HostConfig> hostConfigCustomizer) {
        return callDocker("create container", () -> {
            HostConfig hostConfig = HostConfig.newHostConfig();
            if (hostConfigCustomizer != null) {
                hostConfig = hostConfigCustomizer.apply(hostConfig);
            }
            CreateContainerCmd createCmd = dockerClient.createContainerCmd(image)
                .withHostConfig(hostConfig)
                .withEnv(toEnvArray(env));
            if (labels != null && !labels.isEmpty()) {
                createCmd = createCmd.withLabels(labels);
            }
            if (containerName != null && !containerName.isBlank()) {
                createCmd = createCmd.withName(containerName);
            }
            CreateContainerResponse response = createCmd.exec();
            return response.getId();
        });
    }

    public void startContainer(String containerId) {
        callDocker("start container", () -> dockerClient.startContainerCmd(containerId).exec());
    }

    /**
     * Stop a container, waiting up to {@code timeout} before the daemon kills it.
     * Stopping a container that is already stopped or gone is not an error.
     */
    public void stopContainer(String containerId, Duration timeout) {
        int seconds = (int) Math.max(1, timeout.toSeconds());
        callDocker("stop container", () -> {
            try {
                dockerClient.stopContainerCmd(containerId).withTimeout(seconds).exec();
            } catch (NotModifiedException e) {
                log.debug("container {} was already stopped", containerId);
            } catch (NotFoundException e) {
                log.debug("container {} no longer exists", containerId);
            }
        });
    }

    /**
     * Remove a container. Removing a container that is already gone is not an error.
     */
    public void removeContainer(String containerId) {
        callDocker("remove container", () -> {
            try {
                dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            } catch (NotFoundException e) {
                log.debug("container {} was already removed", containerId);
            }
        });
    }

    public void stopAndRemoveContainer(String containerId, Duration timeout) {
        stopContainer(containerId, timeout);
        removeContainer(containerId);
    }

    public Optional<InspectContainerResponse> inspectContainer(String containerId) {
        return callDocker("inspect container", () -> {
            try {
                return Optional.of(dockerClient.inspectContainerCmd(containerId).exec());
            } catch (NotFoundException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * All containers, running or not, carrying every one of the given labels.
     */
    public List<Container> listContainers(Map<String, String> labels) {
        return callDocker("list containers", () -> dockerClient.listContainersCmd()
            .withShowAll(true)
            .withLabelFilter(labels)
            .exec());
    }

    /**
     * Up to {@code lines} of the container's most recent stdout/stderr output.
     */
    public String tailLogs(String containerId, int lines, Duration timeout) {
        StringBuilder output = new StringBuilder();
        ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                output.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
            }
        };
        callDocker("read container logs", () -> {
            try {
                dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withTail(lines)
                    .exec(callback)
                    .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (NotFoundException e) {
                log.debug("container {} is gone; no logs to read", containerId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        return output.toString();
    }

    /**
     * Subscribe to container events for containers carrying the given labels.
     * Closing the returned handle ends the subscription.
     */
    public Closeable streamEvents(Map<String, String> labels,
                                  Consumer<Event> onEvent,
                                  Consumer<Throwable> onTermination) {
        ResultCallback.Adapter<Event> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Event event) {
                if (event.getType() == null || event.getType() == EventType.CONTAINER) {
                    onEvent.accept(event);
                }
            }

            @Override
            public void onError(Throwable throwable) {
                super.onError(throwable);
                onTermination.accept(translate("stream events", asRuntime(throwable)));
            }

            @Override
            public void onComplete() {
                super.onComplete();
                onTermination.accept(null);
            }
        };
        return callDocker("stream events", () -> dockerClient.eventsCmd()
            .withLabelFilter(labels)
            .exec(callback));
    }

    /**
     * Network to attach workers to: the configured one, or the first non-default network of the
     * container this process runs in.
     */
    public String resolveNetwork(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String self = System.getenv("HOSTNAME");
        if (self == null || self.isBlank()) {
            return null;
        }
        try {
            InspectContainerResponse inspect = dockerClient.inspectContainerCmd(self).exec();
            return inspect.getNetworkSettings().getNetworks().keySet().stream()
                .filter(n -> !"bridge".equals(n))
                .findFirst().orElse(null);
        } catch (RuntimeException e) {
            log.debug("unable to detect network of container {}: {}", self, e.getMessage());
            return null;
        }
    }

    private String[] toEnvArray(Map<String, String> env) {
        if (env == null) {
            return new String[0];
        }
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toArray(String[]::new);
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private static RuntimeException asRuntime(Throwable throwable) {
        return throwable instanceof RuntimeException runtime ? runtime : new RuntimeException(throwable);
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerDaemonUnavailableException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(action, DOCKER_HINT, e);
        }
        return e;
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof DockerDaemonUnavailableException
                || t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            String className = t.getClass().getName();
            if ("com.sun.jna.LastErrorException".equals(className)
                && messageContains(t, "No such file or directory")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
