package io.github.themoah.feedrace.model;

import java.util.Objects;

/**
 * Stable identity of a configured feed. Assigned once from configuration and
 * compared by equality only.
 *
 * @param name configured stream name, unique within a race
 * @param endpoint endpoint URL the stream subscribes to
 */
public record StreamIdentity(String name, String endpoint) {

  public StreamIdentity {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(endpoint, "endpoint cannot be null");
  }

  @Override
  public String toString() {
    return name;
  }
}
