package com.scholary.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the streaming relay.
 *
 * <p>Controls queue bounds, timeouts, worker pool size and WebSocket buffer limits.
 */
@ConfigurationProperties(prefix = "relay")
@Validated
public record RelayProperties(
    @Positive int queueCapacity,
    @Positive int offerTimeoutMillis,
    @Min(0) int idleTimeoutSeconds,
    @Positive int workerThreads,
    @Min(0) int workerQueueSize,
    @Positive int maxBinaryMessageBytes,
    @Positive int maxTextMessageBytes,
    @Positive int sendTimeLimitMillis,
    @Positive int sendBufferSizeLimitBytes,
    @Valid AuthProperties auth,
    @Valid ArchiveProperties archive) {

  public RelayProperties {
    auth = auth == null ? new AuthProperties(Map.of()) : auth;
    archive = archive == null ? new ArchiveProperties(false) : archive;
  }

  public Duration offerTimeout() {
    return Duration.ofMillis(offerTimeoutMillis);
  }

  public Duration idleTimeout() {
    return Duration.ofSeconds(idleTimeoutSeconds);
  }

  /** Static bearer tokens for the built-in verifier, token to principal id. */
  public record AuthProperties(Map<String, String> tokens) {

    public AuthProperties {
      tokens = tokens == null ? Map.of() : Map.copyOf(tokens);
    }
  }

  public record ArchiveProperties(boolean enabled) {}
}
