package com.scholary.relay.gateway;

/**
 * Unknown session, one the caller does not own, or one that is not accepting audio. All three are
 * reported to the client the same way.
 */
public class SessionNotFoundException extends GatewayRejectedException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }

  public SessionNotFoundException(String sessionId, SessionStatus status) {
    super("Session " + sessionId + " is not active (" + status.name().toLowerCase() + ")");
  }

  @Override
  public String code() {
    return "SESSION_NOT_FOUND";
  }
}
