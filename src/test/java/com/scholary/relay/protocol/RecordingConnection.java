package com.scholary.relay.protocol;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory {@link ClientConnection} that records what the relay sends. */
public class RecordingConnection implements ClientConnection {

  private final List<ServerMessage> sent = new CopyOnWriteArrayList<>();
  private final AtomicInteger closeCount = new AtomicInteger();
  private volatile CloseCode closeCode;
  private volatile boolean open = true;

  @Override
  public String id() {
    return "test-connection";
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void send(ServerMessage message) throws IOException {
    if (!open) {
      throw new IOException("connection closed");
    }
    sent.add(message);
  }

  @Override
  public void close(CloseCode code, String reason) {
    closeCount.incrementAndGet();
    closeCode = code;
    open = false;
  }

  /** Simulate the peer going away without a close from our side. */
  public void drop() {
    open = false;
  }

  public List<ServerMessage> sent() {
    return new ArrayList<>(sent);
  }

  public <T extends ServerMessage> List<T> sent(Class<T> type) {
    return sent.stream().filter(type::isInstance).map(type::cast).toList();
  }

  public int closeCount() {
    return closeCount.get();
  }

  public CloseCode closeCode() {
    return closeCode;
  }
}
