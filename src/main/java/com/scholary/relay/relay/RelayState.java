package com.scholary.relay.relay;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one relay instance.
 *
 * <pre>
 * CONNECTING -> AUTHENTICATED -> STREAMING -> STOPPING -> CLOSED
 *                                          \-> FAILED  -> CLOSED
 * </pre>
 *
 * <p>STOPPING may still turn into FAILED if the backend fails while draining.
 */
public enum RelayState {
  CONNECTING,
  AUTHENTICATED,
  STREAMING,
  STOPPING,
  FAILED,
  CLOSED;

  private Set<RelayState> next() {
    return switch (this) {
      case CONNECTING -> EnumSet.of(AUTHENTICATED, FAILED, CLOSED);
      case AUTHENTICATED -> EnumSet.of(STREAMING, FAILED, CLOSED);
      case STREAMING -> EnumSet.of(STOPPING, FAILED);
      case STOPPING -> EnumSet.of(FAILED, CLOSED);
      case FAILED -> EnumSet.of(CLOSED);
      case CLOSED -> EnumSet.noneOf(RelayState.class);
    };
  }

  public boolean canTransitionTo(RelayState target) {
    return next().contains(target);
  }

  /** Whether transcript and VAD messages may still be delivered to the client. */
  public boolean isDelivering() {
    return this == STREAMING || this == STOPPING;
  }
}
