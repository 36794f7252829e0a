package com.scholary.relay.gateway;

public class AuthenticationException extends GatewayRejectedException {

  public AuthenticationException(String message) {
    super(message);
  }

  @Override
  public String code() {
    return "AUTHENTICATION_FAILED";
  }
}
