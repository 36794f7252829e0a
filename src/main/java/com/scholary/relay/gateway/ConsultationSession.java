package com.scholary.relay.gateway;

/**
 * A consultation session that audio can be streamed into.
 *
 * @param ownerId principal id of the user who owns the session
 */
public record ConsultationSession(String id, String ownerId, SessionStatus status) {

  public boolean isOwnedBy(Principal principal) {
    return ownerId.equals(principal.id());
  }
}
