package com.scholary.relay.api;

import com.scholary.relay.protocol.ClientConnection;
import com.scholary.relay.protocol.CloseCode;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.protocol.ServerMessage;
import java.io.IOException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

/**
 * {@link ClientConnection} over a Spring WebSocket session.
 *
 * <p>The session must be safe for concurrent sends (see {@code
 * ConcurrentWebSocketSessionDecorator}); messages are sent from the container thread, the
 * recognition worker and the transport thread.
 */
class WebSocketClientConnection implements ClientConnection {

  private final WebSocketSession session;
  private final MessageCodec codec;

  WebSocketClientConnection(WebSocketSession session, MessageCodec codec) {
    this.session = session;
    this.codec = codec;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(ServerMessage message) throws IOException {
    try {
      session.sendMessage(new TextMessage(codec.encode(message)));
    } catch (SessionLimitExceededException e) {
      throw new IOException("Client is not keeping up: " + e.getMessage(), e);
    }
  }

  @Override
  public void close(CloseCode code, String reason) throws IOException {
    session.close(new CloseStatus(code.code(), reason));
  }
}
