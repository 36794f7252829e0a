package com.scholary.relay.streaming;

/**
 * An element taken from a {@link BridgeQueue}: either one audio payload or the end-of-input marker.
 *
 * <p>The end marker is a distinct instance rather than a null payload so callers never have to
 * guess whether an empty or missing frame means "stop".
 */
public final class BridgeItem {

  /** Marks the end of input. Returned forever once the queue is closed and drained. */
  public static final BridgeItem END = new BridgeItem(new byte[0], true);

  private final byte[] payload;
  private final boolean end;

  private BridgeItem(byte[] payload, boolean end) {
    this.payload = payload;
    this.end = end;
  }

  static BridgeItem audio(byte[] payload) {
    return new BridgeItem(payload, false);
  }

  public boolean isEnd() {
    return end;
  }

  public byte[] payload() {
    if (end) {
      throw new IllegalStateException("End marker carries no audio");
    }
    return payload;
  }
}
