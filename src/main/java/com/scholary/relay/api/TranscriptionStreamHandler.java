package com.scholary.relay.api;

import com.scholary.relay.config.RelayProperties;
import com.scholary.relay.gateway.ConnectionGateway;
import com.scholary.relay.logging.StructuredLogger;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.relay.StreamingRelay;
import java.nio.ByteBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * WebSocket endpoint for live transcription.
 *
 * <p>On connect the gateway authenticates the client and starts a relay; binary frames are audio,
 * text frames are control messages, and closing the socket ends the audio input.
 */
@Component
public class TranscriptionStreamHandler extends AbstractWebSocketHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionStreamHandler.class);

  private static final String RELAY_ATTRIBUTE = "relay.instance";

  private final ConnectionGateway gateway;
  private final MessageCodec codec;
  private final RelayProperties properties;

  public TranscriptionStreamHandler(
      ConnectionGateway gateway, MessageCodec codec, RelayProperties properties) {
    this.gateway = gateway;
    this.codec = codec;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    session.setBinaryMessageSizeLimit(properties.maxBinaryMessageBytes());
    session.setTextMessageSizeLimit(properties.maxTextMessageBytes());

    WebSocketSession concurrent =
        new ConcurrentWebSocketSessionDecorator(
            session, properties.sendTimeLimitMillis(), properties.sendBufferSizeLimitBytes());
    String sessionId = (String) session.getAttributes().get(
        SessionHandshakeInterceptor.SESSION_ID_ATTRIBUTE);
    String token = (String) session.getAttributes().get(
        SessionHandshakeInterceptor.TOKEN_ATTRIBUTE);

    LOGGER.info("WebSocket {} opened for session {}", session.getId(), sessionId);
    gateway
        .open(new WebSocketClientConnection(concurrent, codec), token, sessionId)
        .ifPresent(relay -> session.getAttributes().put(RELAY_ATTRIBUTE, relay));
  }

  @Override
  protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
    StreamingRelay relay = relay(session);
    if (relay == null) {
      return;
    }
    ByteBuffer payload = message.getPayload();
    byte[] audio = new byte[payload.remaining()];
    payload.get(audio);

    withRelayContext(relay, () -> relay.ingress().onAudio(audio));
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    StreamingRelay relay = relay(session);
    if (relay == null) {
      return;
    }
    withRelayContext(relay, () -> relay.ingress().onControl(message.getPayload()));
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    LOGGER.debug("Transport error on WebSocket {}: {}", session.getId(), exception.toString());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    StreamingRelay relay = relay(session);
    LOGGER.info("WebSocket {} closed: {}", session.getId(), status);
    if (relay != null) {
      withRelayContext(relay, () -> relay.ingress().onDisconnect());
    }
  }

  private static StreamingRelay relay(WebSocketSession session) {
    return (StreamingRelay) session.getAttributes().get(RELAY_ATTRIBUTE);
  }

  private static void withRelayContext(StreamingRelay relay, Runnable action) {
    StructuredLogger.setRelayContext(relay.sessionId(), relay.relayId(), relay.principalId());
    try {
      action.run();
    } finally {
      StructuredLogger.clearRelayContext();
    }
  }
}
