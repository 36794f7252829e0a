package com.scholary.relay.streaming;

/**
 * Thrown when audio arrives faster than the recognition backend consumes it.
 *
 * <p>The bridge queue is bounded; if a frame cannot be enqueued within the configured wait, the
 * relay is failed instead of buffering without limit or silently dropping audio.
 */
public class BackpressureException extends RuntimeException {

  public BackpressureException(String message) {
    super(message);
  }
}
