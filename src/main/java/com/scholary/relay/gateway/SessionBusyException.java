package com.scholary.relay.gateway;

public class SessionBusyException extends GatewayRejectedException {

  public SessionBusyException(String sessionId) {
    super("Session " + sessionId + " already has an active transcription stream");
  }

  @Override
  public String code() {
    return "SESSION_BUSY";
  }
}
