package io.feedhive.feedcontroller.infra.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import io.feedhive.docker.DockerContainerClient;
import io.feedhive.feedcontroller.config.FeedControllerProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connects to the Docker daemon named by {@code feedhive.controller.docker}: an explicit host
 * when one is set, the mounted socket otherwise.
 */
@Configuration
public class DockerConfiguration {
  private static final Logger log = LoggerFactory.getLogger(DockerConfiguration.class);
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  // one long-lived event stream plus launches and stops running in parallel
  static final int MAX_CONNECTIONS = 32;

  private final FeedControllerProperties.Docker docker;

  public DockerConfiguration(FeedControllerProperties properties) {
    this.docker = properties.getDocker();
  }

  static String daemonHost(FeedControllerProperties.Docker docker) {
    return docker.hasHost() ? docker.host() : "unix://" + docker.socketPath();
  }

  @Bean
  public DefaultDockerClientConfig dockerClientConfig() {
    String host = daemonHost(docker);
    log.info("using docker daemon at {}", host);
    return DefaultDockerClientConfig.createDefaultConfigBuilder()
        .withDockerHost(host)
        .build();
  }

  @Bean(destroyMethod = "close")
  public DockerClient dockerClient(DefaultDockerClientConfig config) {
    ApacheDockerHttpClient transport = new ApacheDockerHttpClient.Builder()
        .dockerHost(config.getDockerHost())
        .sslConfig(config.getSSLConfig())
        .connectionTimeout(CONNECT_TIMEOUT)
        .maxConnections(MAX_CONNECTIONS)
        .build();
    return DockerClientImpl.getInstance(config, transport);
  }

  @Bean
  public DockerContainerClient dockerContainerClient(DockerClient dockerClient) {
    return new DockerContainerClient(dockerClient);
  }
}
