package com.scholary.relay.gateway;

import java.util.Optional;

/** Lookup of consultation sessions by id. */
public interface SessionRepository {

  Optional<ConsultationSession> findById(String sessionId);

  void save(ConsultationSession session);
}
