package com.scholary.relay.streaming;

/** Thrown when a relay receives no audio for longer than the configured idle timeout. */
public class IdleTimeoutException extends RuntimeException {

  public IdleTimeoutException(String message) {
    super(message);
  }
}
