package io.feedhive.feedcontroller.infra.docker;

import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Event;
import com.github.dockerjava.api.model.HostConfig;
import io.feedhive.docker.DockerContainerClient;
import io.feedhive.feedcontroller.runtime.LaunchSpec;
import io.feedhive.feedcontroller.runtime.RuntimeCallException;
import io.feedhive.feedcontroller.runtime.RuntimeClient;
import io.feedhive.feedcontroller.runtime.RuntimeEvent;
import io.feedhive.feedcontroller.runtime.RuntimeEventListener;
import io.feedhive.feedcontroller.runtime.RuntimeWorker;
import java.io.Closeable;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Docker-backed {@link RuntimeClient}.
 */
public final class DockerRuntimeClient implements RuntimeClient {

  private static final Logger log = LoggerFactory.getLogger(DockerRuntimeClient.class);
  private static final Duration LOG_READ_TIMEOUT = Duration.ofSeconds(5);

  private final DockerContainerClient docker;

  public DockerRuntimeClient(DockerContainerClient docker) {
    this.docker = Objects.requireNonNull(docker, "docker");
  }

  @Override
  public String launch(LaunchSpec spec) {
    Objects.requireNonNull(spec, "spec");
    log.info("creating container {} using image {}", spec.name(), spec.image());
    String containerId = call("create container " + spec.name(), () ->
        docker.createContainer(spec.image(), spec.environment(), spec.name(), spec.labels(),
            hostConfig -> customize(hostConfig, spec)));
    log.info("starting container {} ({})", containerId, spec.name());
    try {
      docker.startContainer(containerId);
    } catch (RuntimeException e) {
      log.warn("container {} ({}) failed to start; removing it", containerId, spec.name());
      try {
        docker.removeContainer(containerId);
      } catch (RuntimeException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw new RuntimeCallException("start container " + spec.name() + " failed: " + e.getMessage(), e);
    }
    return containerId;
  }

  @Override
  public void stop(String runtimeId, Duration timeout) {
    log.info("stopping container {}", runtimeId);
    call("stop container " + runtimeId, () -> {
      docker.stopContainer(runtimeId, timeout);
      return null;
    });
  }

  @Override
  public void remove(String runtimeId) {
    log.info("removing container {}", runtimeId);
    call("remove container " + runtimeId, () -> {
      docker.removeContainer(runtimeId);
      return null;
    });
  }

  @Override
  public Optional<RuntimeWorker> inspect(String runtimeId) {
    return call("inspect container " + runtimeId, () -> docker.inspectContainer(runtimeId))
        .map(DockerRuntimeClient::toWorker);
  }

  @Override
  public List<RuntimeWorker> list(Map<String, String> labelFilter) {
    return call("list containers", () -> docker.listContainers(labelFilter)).stream()
        .map(DockerRuntimeClient::toWorker)
        .toList();
  }

  @Override
  public Closeable subscribe(Map<String, String> labelFilter, RuntimeEventListener listener) {
    Objects.requireNonNull(listener, "listener");
    return call("subscribe to container events", () -> docker.streamEvents(labelFilter,
        event -> listener.onEvent(toEvent(event)),
        listener::onClosed));
  }

  @Override
  public String recentLogs(String runtimeId, int lines) {
    return call("read logs of container " + runtimeId,
        () -> docker.tailLogs(runtimeId, lines, LOG_READ_TIMEOUT));
  }

  @Override
  public String resolveNetwork(String configured) {
    String network = docker.resolveNetwork(configured);
    if (network == null) {
      log.warn("no worker network configured or detected; workers use the runtime's default network");
    } else if (configured == null || configured.isBlank()) {
      log.info("attaching workers to detected network {}", network);
    }
    return network;
  }

  private static HostConfig customize(HostConfig hostConfig, LaunchSpec spec) {
    HostConfig customized = hostConfig;
    if (spec.network() != null && !spec.network().isBlank()) {
      customized = customized.withNetworkMode(spec.network());
    }
    if (spec.volume() != null && !spec.volume().isBlank()) {
      customized = customized.withBinds(Bind.parse(spec.volume()));
    }
    return customized;
  }

  static RuntimeWorker toWorker(Container container) {
    String[] names = container.getNames();
    String name = names != null && names.length > 0 ? stripSlash(names[0]) : null;
    String status = container.getStatus();
    String health = status != null && status.contains("(unhealthy)") ? "unhealthy" : null;
    return new RuntimeWorker(container.getId(), name, container.getLabels(), container.getState(), health, null);
  }

  static RuntimeWorker toWorker(InspectContainerResponse response) {
    InspectContainerResponse.ContainerState state = response.getState();
    String status = null;
    String health = null;
    Long exitCode = null;
    if (state != null) {
      status = state.getStatus();
      if (status == null && state.getRunning() != null) {
        status = state.getRunning() ? "running" : "exited";
      }
      if (state.getHealth() != null) {
        health = state.getHealth().getStatus();
      }
      if (!Boolean.TRUE.equals(state.getRunning())) {
        exitCode = state.getExitCodeLong();
      }
    }
    Map<String, String> labels = response.getConfig() != null ? response.getConfig().getLabels() : null;
    return new RuntimeWorker(response.getId(), stripSlash(response.getName()), labels, status, health, exitCode);
  }

  static RuntimeEvent toEvent(Event event) {
    Map<String, String> attributes = event.getActor() != null ? event.getActor().getAttributes() : null;
    String name = attributes != null ? attributes.get("name") : null;
    String exitCode = attributes != null ? attributes.get("exitCode") : null;
    String action = event.getAction() != null ? event.getAction() : event.getStatus();
    String detail = exitCode != null ? action + " (exit code " + exitCode + ")" : action;
    return new RuntimeEvent(event.getId(), name, action, detail);
  }

  private static String stripSlash(String name) {
    if (name == null) {
      return null;
    }
    return name.startsWith("/") ? name.substring(1) : name;
  }

  private static <T> T call(String action, Supplier<T> supplier) {
    try {
      return supplier.get();
    } catch (RuntimeCallException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RuntimeCallException(action + " failed: " + e.getMessage(), e);
    }
  }
}
