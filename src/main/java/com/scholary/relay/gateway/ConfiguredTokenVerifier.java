package com.scholary.relay.gateway;

import com.scholary.relay.config.RelayProperties;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Token verifier backed by the static {@code relay.auth.tokens} map (token to principal id).
 *
 * <p>Suitable for development and for deployments that terminate real authentication in front
 * of the relay. Replace with another {@link TokenVerifier} bean to validate signed tokens.
 */
@Component
public class ConfiguredTokenVerifier implements TokenVerifier {

  private final Map<String, String> tokens;

  public ConfiguredTokenVerifier(RelayProperties properties) {
    this.tokens = properties.auth().tokens();
  }

  @Override
  public Principal verify(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthenticationException("Missing authentication token");
    }
    String principalId = tokens.get(token.strip());
    if (principalId == null) {
      throw new AuthenticationException("Invalid authentication token");
    }
    return new Principal(principalId);
  }
}
