package com.scholary.relay.api;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Copies the session id and bearer token from the upgrade request into the WebSocket session
 * attributes.
 *
 * <p>The session id comes from the path ({@code /ws/transcribe/stream/{sessionId}}) or the legacy
 * {@code session_id} query parameter. The token comes from the {@code token} query parameter, or
 * the {@code Authorization: Bearer} header when the parameter is absent. The handshake is never
 * refused here: a missing or bad credential is reported after the upgrade with a policy-violation
 * close so the client can tell why it was turned away.
 */
@Component
public class SessionHandshakeInterceptor implements HandshakeInterceptor {

  static final String SESSION_ID_ATTRIBUTE = "relay.sessionId";
  static final String TOKEN_ATTRIBUTE = "relay.token";

  private static final String STREAM_PATH_PREFIX = "/ws/transcribe/stream/";
  private static final String BEARER_PREFIX = "Bearer ";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    UriComponents uri = UriComponentsBuilder.fromUri(request.getURI()).build();
    MultiValueMap<String, String> query = uri.getQueryParams();

    String sessionId = sessionIdFromPath(uri.getPath());
    if (sessionId == null) {
      sessionId = decode(query.getFirst("session_id"));
    }
    String token = decode(query.getFirst("token"));
    if (token == null) {
      token = bearerToken(request.getHeaders());
    }

    if (sessionId != null) {
      attributes.put(SESSION_ID_ATTRIBUTE, sessionId);
    }
    if (token != null) {
      attributes.put(TOKEN_ATTRIBUTE, token);
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}

  static String sessionIdFromPath(String path) {
    if (path == null) {
      return null;
    }
    int start = path.indexOf(STREAM_PATH_PREFIX);
    if (start < 0) {
      return null;
    }
    String id = path.substring(start + STREAM_PATH_PREFIX.length());
    if (id.endsWith("/")) {
      id = id.substring(0, id.length() - 1);
    }
    return id.isEmpty() || id.contains("/") ? null : decode(id);
  }

  static String bearerToken(HttpHeaders headers) {
    String header = headers.getFirst(HttpHeaders.AUTHORIZATION);
    if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = header.substring(BEARER_PREFIX.length()).strip();
    return token.isEmpty() ? null : token;
  }

  private static String decode(String value) {
    return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
  }
}
