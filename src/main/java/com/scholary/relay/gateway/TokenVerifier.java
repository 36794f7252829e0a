package com.scholary.relay.gateway;

/** Verifies an opaque bearer credential presented at connection time. */
public interface TokenVerifier {

  /**
   * @return the caller the token identifies
   * @throws AuthenticationException if the token is missing, malformed, expired or unknown
   */
  Principal verify(String token);
}
