package io.feedhive.feedcontroller.runtime;

import java.util.Map;
import java.util.Objects;

/**
 * Everything the runtime needs to start one worker.
 *
 * @param volume bind mount in {@code host:container} form, or {@code null}
 */
public record LaunchSpec(String name,
                         String image,
                         Map<String, String> environment,
                         String network,
                         Map<String, String> labels,
                         String volume) {

  public LaunchSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(image, "image");
    environment = environment == null ? Map.of() : Map.copyOf(environment);
    labels = labels == null ? Map.of() : Map.copyOf(labels);
  }
}
