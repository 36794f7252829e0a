package com.scholary.relay.protocol;

/** Control messages a client can send as a text frame, e.g. {@code {"type":"stop"}}. */
public enum ControlMessage {
  STOP("stop"),
  PAUSE("pause"),
  RESUME("resume");

  private final String wireName;

  ControlMessage(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  static ControlMessage fromWireName(String type) {
    for (ControlMessage message : values()) {
      if (message.wireName.equals(type)) {
        return message;
      }
    }
    return null;
  }
}
