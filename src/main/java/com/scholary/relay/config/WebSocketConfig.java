package com.scholary.relay.config;

import com.scholary.relay.api.SessionHandshakeInterceptor;
import com.scholary.relay.api.TranscriptionStreamHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the transcription WebSocket endpoints.
 *
 * <p>{@code /ws/transcribe/stream/{sessionId}} is the primary form; {@code /ws/transcribe} takes
 * the session id as a {@code session_id} query parameter.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final TranscriptionStreamHandler handler;
  private final SessionHandshakeInterceptor handshakeInterceptor;
  private final RelayProperties properties;

  public WebSocketConfig(
      TranscriptionStreamHandler handler,
      SessionHandshakeInterceptor handshakeInterceptor,
      RelayProperties properties) {
    this.handler = handler;
    this.handshakeInterceptor = handshakeInterceptor;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(handler, "/ws/transcribe/stream/*", "/ws/transcribe")
        .addInterceptors(handshakeInterceptor)
        .setAllowedOriginPatterns("*");
  }

  /** Container-wide buffer limits; audio frames larger than this are rejected by the server. */
  @Bean
  public ServletServerContainerFactoryBean createWebSocketContainer() {
    ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
    container.setMaxBinaryMessageBufferSize(properties.maxBinaryMessageBytes());
    container.setMaxTextMessageBufferSize(properties.maxTextMessageBytes());
    container.setAsyncSendTimeout((long) properties.sendTimeLimitMillis());
    return container;
  }
}
