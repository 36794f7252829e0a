package com.scholary.relay.gateway;

/**
 * Connection refused before any audio is accepted.
 *
 * <p>The message is safe to show to the client; {@link #code()} is a stable machine-readable
 * reason used in logs.
 */
public abstract class GatewayRejectedException extends RuntimeException {

  protected GatewayRejectedException(String message) {
    super(message);
  }

  public abstract String code();
}
