package io.github.themoah.feedrace.config;

import io.github.themoah.feedrace.model.StreamIdentity;
import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * One configured upstream feed.
 *
 * @param name unique stream name
 * @param endpoint gRPC endpoint, {@code https://} for TLS or {@code http://} for plaintext
 * @param accessToken optional {@code x-token} credential, null when absent
 */
public record StreamConfig(
  String name,
  URI endpoint,
  String accessToken
) {

  private static final int DEFAULT_TLS_PORT = 443;
  private static final int DEFAULT_PLAINTEXT_PORT = 80;

  public StreamConfig {
    if (name == null || name.isBlank()) {
      throw new ConfigException("Stream name cannot be empty");
    }
    if (endpoint == null) {
      throw new ConfigException("Stream '" + name + "' has no endpoint");
    }
    String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("https") && !scheme.equals("http")) {
      throw new ConfigException("Stream '" + name + "' endpoint must use http or https: " + endpoint);
    }
    if (endpoint.getHost() == null) {
      throw new ConfigException("Stream '" + name + "' endpoint has no host: " + endpoint);
    }
    if (accessToken != null && accessToken.isBlank()) {
      accessToken = null;
    }
  }

  /**
   * Parses an endpoint string into a stream definition.
   *
   * @throws ConfigException if the endpoint is missing or not a valid URI
   */
  public static StreamConfig of(String name, String endpoint, String accessToken) {
    if (endpoint == null || endpoint.isBlank()) {
      throw new ConfigException("Stream '" + name + "' has no endpoint");
    }
    try {
      return new StreamConfig(name, URI.create(endpoint.trim()), accessToken);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Stream '" + name + "' has an invalid endpoint: " + endpoint, e);
    }
  }

  public StreamIdentity identity() {
    return new StreamIdentity(name, endpoint.toString());
  }

  public Optional<String> token() {
    return Optional.ofNullable(accessToken);
  }

  public boolean usesTls() {
    return "https".equalsIgnoreCase(endpoint.getScheme());
  }

  public String host() {
    return endpoint.getHost();
  }

  public int port() {
    if (endpoint.getPort() != -1) {
      return endpoint.getPort();
    }
    return usesTls() ? DEFAULT_TLS_PORT : DEFAULT_PLAINTEXT_PORT;
  }

  @Override
  public String toString() {
    return "StreamConfig[name=" + name + ", endpoint=" + endpoint
      + ", accessToken=" + (accessToken == null ? "none" : "****") + "]";
  }
}
