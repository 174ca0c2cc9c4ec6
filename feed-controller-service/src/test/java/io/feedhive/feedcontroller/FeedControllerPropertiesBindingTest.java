package io.feedhive.feedcontroller;

import static org.assertj.core.api.Assertions.assertThat;

import io.feedhive.feedcontroller.config.FeedControllerProperties;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class FeedControllerPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(Config.class);

  @Test
  void bindsWhenOnlyDirectoriesProvided() {
    contextRunner
        .withPropertyValues(
            "feedhive.controller.config-dir=/data/ldes-feeds",
            "feedhive.controller.state-root=/data/state")
        .run(
            context -> {
              FeedControllerProperties properties = context.getBean(FeedControllerProperties.class);
              assertThat(properties.getConfigDir()).isEqualTo(Path.of("/data/ldes-feeds"));
              assertThat(properties.getHostStateRoot()).isEqualTo(Path.of("/data/state"));
              assertThat(properties.getLogsDir()).isNull();
              assertThat(properties.getLock().path()).isEqualTo(Path.of("/data/ldes-feeds/.spawn.lock"));
              assertThat(properties.getLock().retries()).isEqualTo(10);
              assertThat(properties.getWorker().image()).isEqualTo("ghcr.io/maregraph-eu/ldes2sparql:latest");
              assertThat(properties.getWorker().network()).isNull();
              assertThat(properties.getWorker().removeContainers()).isTrue();
              assertThat(properties.getTiming().debounce()).isEqualTo(Duration.ofMillis(1500));
              assertThat(properties.getTiming().stopRetries()).isEqualTo(3);
              assertThat(properties.getDocker().hasHost()).isFalse();
              assertThat(properties.getDocker().socketPath()).isEqualTo("/var/run/docker.sock");
            });
  }

  @Test
  void bindsExplicitSettings() {
    contextRunner
        .withPropertyValues(
            "feedhive.controller.config-dir=/data/ldes-feeds",
            "feedhive.controller.state-root=/data/state",
            "feedhive.controller.host-state-root=/srv/kgap/state",
            "feedhive.controller.logs-dir=/data/logs",
            "feedhive.controller.lock.path=/run/feedhive.lock",
            "feedhive.controller.worker.network=kgap_default",
            "feedhive.controller.worker.log-level=DEBUG",
            "feedhive.controller.worker.remove-containers=false",
            "feedhive.controller.timing.health-poll-interval=5s",
            "feedhive.controller.timing.launch-timeout=250ms",
            "feedhive.controller.docker.host=tcp://docker-proxy:2375")
        .run(
            context -> {
              FeedControllerProperties properties = context.getBean(FeedControllerProperties.class);
              assertThat(properties.getHostStateRoot()).isEqualTo(Path.of("/srv/kgap/state"));
              assertThat(properties.getLogsDir()).isEqualTo(Path.of("/data/logs"));
              assertThat(properties.getLock().path()).isEqualTo(Path.of("/run/feedhive.lock"));
              assertThat(properties.getWorker().network()).isEqualTo("kgap_default");
              assertThat(properties.getWorker().logLevel()).isEqualTo("debug");
              assertThat(properties.getWorker().removeContainers()).isFalse();
              assertThat(properties.getTiming().healthPollInterval()).isEqualTo(Duration.ofSeconds(5));
              assertThat(properties.getTiming().launchTimeout()).isEqualTo(Duration.ofMillis(250));
              assertThat(properties.getDocker().host()).isEqualTo("tcp://docker-proxy:2375");
            });
  }

  @Test
  void failsWithoutConfigurationDirectory() {
    contextRunner
        .withPropertyValues("feedhive.controller.state-root=/data/state")
        .run(context -> assertThat(context).hasFailed());
  }

  @EnableConfigurationProperties(FeedControllerProperties.class)
  private static class Config {}
}
