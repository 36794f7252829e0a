package com.scholary.relay.gateway;

/** Lifecycle of a consultation session as seen by the relay. */
public enum SessionStatus {
  CREATED,
  ACTIVE,
  PAUSED,
  ENDED;

  /** Audio may only be streamed into a session that is running or temporarily paused. */
  public boolean acceptsAudio() {
    return this == ACTIVE || this == PAUSED;
  }
}
