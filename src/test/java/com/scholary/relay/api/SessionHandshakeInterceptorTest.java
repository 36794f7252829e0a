package com.scholary.relay.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class SessionHandshakeInterceptorTest {

  private final SessionHandshakeInterceptor interceptor = new SessionHandshakeInterceptor();

  @Test
  void readsSessionFromPathAndTokenFromQuery() {
    Map<String, Object> attributes = handshake("/ws/transcribe/stream/S1", "token=abc", null);

    assertThat(attributes)
        .containsEntry(SessionHandshakeInterceptor.SESSION_ID_ATTRIBUTE, "S1")
        .containsEntry(SessionHandshakeInterceptor.TOKEN_ATTRIBUTE, "abc");
  }

  @Test
  void readsLegacyQueryParameters() {
    Map<String, Object> attributes =
        handshake("/ws/transcribe", "session_id=S%2042&token=a%2Bb", null);

    assertThat(attributes)
        .containsEntry(SessionHandshakeInterceptor.SESSION_ID_ATTRIBUTE, "S 42")
        .containsEntry(SessionHandshakeInterceptor.TOKEN_ATTRIBUTE, "a+b");
  }

  @Test
  void fallsBackToBearerHeader() {
    Map<String, Object> attributes =
        handshake("/ws/transcribe/stream/S1", null, "Bearer header-token");

    assertThat(attributes).containsEntry(SessionHandshakeInterceptor.TOKEN_ATTRIBUTE, "header-token");
  }

  @Test
  void queryTokenWinsOverHeader() {
    Map<String, Object> attributes =
        handshake("/ws/transcribe/stream/S1", "token=query-token", "Bearer header-token");

    assertThat(attributes).containsEntry(SessionHandshakeInterceptor.TOKEN_ATTRIBUTE, "query-token");
  }

  @Test
  void missingValuesAreLeftOutButHandshakeProceeds() {
    Map<String, Object> attributes = handshake("/ws/transcribe", null, "Basic xyz");

    assertThat(attributes).isEmpty();
  }

  @Test
  void parsesBearerHeaderCaseInsensitively() {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.AUTHORIZATION, "bearer  t1 ");

    assertThat(SessionHandshakeInterceptor.bearerToken(headers)).isEqualTo("t1");
    assertThat(SessionHandshakeInterceptor.bearerToken(new HttpHeaders())).isNull();
  }

  @Test
  void extractsSessionIdOnlyFromStreamPath() {
    assertThat(SessionHandshakeInterceptor.sessionIdFromPath("/ws/transcribe/stream/S1/"))
        .isEqualTo("S1");
    assertThat(SessionHandshakeInterceptor.sessionIdFromPath("/ws/transcribe/stream/")).isNull();
    assertThat(SessionHandshakeInterceptor.sessionIdFromPath("/ws/transcribe/stream/a/b")).isNull();
    assertThat(SessionHandshakeInterceptor.sessionIdFromPath("/ws/transcribe")).isNull();
  }

  private Map<String, Object> handshake(String path, String query, String authorization) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
    request.setQueryString(query);
    if (authorization != null) {
      request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    Map<String, Object> attributes = new HashMap<>();

    boolean proceed =
        interceptor.beforeHandshake(
            new ServletServerHttpRequest(request),
            new ServletServerHttpResponse(new MockHttpServletResponse()),
            mock(WebSocketHandler.class),
            attributes);

    assertThat(proceed).isTrue();
    return attributes;
  }
}
