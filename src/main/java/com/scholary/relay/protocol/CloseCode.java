package com.scholary.relay.protocol;

/** WebSocket close codes used by the relay (RFC 6455 section 7.4). */
public enum CloseCode {
  NORMAL(1000),
  POLICY_VIOLATION(1008),
  SERVER_ERROR(1011),
  TRY_AGAIN_LATER(1013);

  private final int code;

  CloseCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
