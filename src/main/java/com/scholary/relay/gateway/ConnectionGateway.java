package com.scholary.relay.gateway;

import com.scholary.relay.logging.StructuredLogger;
import com.scholary.relay.protocol.ClientConnection;
import com.scholary.relay.protocol.CloseCode;
import com.scholary.relay.protocol.ServerMessage;
import com.scholary.relay.relay.RelayFactory;
import com.scholary.relay.relay.RelayRegistry;
import com.scholary.relay.relay.StreamingRelay;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Admits a client connection to a session.
 *
 * <p>Checks, in order: the bearer token, that the session exists and belongs to the caller, that
 * the session is ACTIVE or PAUSED, and that no other relay is streaming it. Any failure sends one
 * error payload and closes with {@link CloseCode#POLICY_VIOLATION}. On success the client gets a
 * {@code connected} acknowledgement and the recognition call is started.
 */
@Component
public class ConnectionGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionGateway.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final TokenVerifier tokenVerifier;
  private final SessionRepository sessionRepository;
  private final RelayFactory relayFactory;
  private final RelayRegistry registry;
  private final Executor relayExecutor;

  public ConnectionGateway(
      TokenVerifier tokenVerifier,
      SessionRepository sessionRepository,
      RelayFactory relayFactory,
      RelayRegistry registry,
      @Qualifier("relayExecutor") Executor relayExecutor) {
    this.tokenVerifier = tokenVerifier;
    this.sessionRepository = sessionRepository;
    this.relayFactory = relayFactory;
    this.registry = registry;
    this.relayExecutor = relayExecutor;
  }

  /**
   * Admit {@code connection} to {@code sessionId}.
   *
   * @return the running relay, or empty if the connection was refused and closed
   */
  public Optional<StreamingRelay> open(ClientConnection connection, String token, String sessionId) {
    ConsultationSession session;
    Principal principal;
    try {
      principal = tokenVerifier.verify(token);
      session = findOwned(principal, sessionId);
      if (!session.status().acceptsAudio()) {
        throw new SessionNotFoundException(sessionId, session.status());
      }
    } catch (GatewayRejectedException e) {
      reject(connection, sessionId, e);
      return Optional.empty();
    }

    StreamingRelay relay = relayFactory.create(session.id(), principal.id(), connection);
    if (!registry.reserve(relay)) {
      reject(connection, sessionId, new SessionBusyException(sessionId));
      return Optional.empty();
    }
    relay.markAuthenticated();

    StructuredLogger.setRelayContext(session.id(), relay.relayId(), principal.id());
    try {
      connection.send(ServerMessage.Connected.ready(session.id()));
      LOGGER.info("Client connected to session {}", session.id());
      relay.start(relayExecutor);
      return Optional.of(relay);
    } catch (IOException e) {
      LOGGER.warn("Client went away before the relay started: {}", e.getMessage());
      relay.abort("client went away before streaming");
      return Optional.empty();
    } finally {
      StructuredLogger.clearRelayContext();
    }
  }

  /**
   * Resolve the caller of a read request for a session's transcript. Unlike {@link #open}, the
   * session may be in any status.
   */
  public ConsultationSession authorize(String token, String sessionId) {
    return findOwned(tokenVerifier.verify(token), sessionId);
  }

  private ConsultationSession findOwned(Principal principal, String sessionId) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new SessionNotFoundException(String.valueOf(sessionId));
    }
    return sessionRepository
        .findById(sessionId)
        .filter(s -> s.isOwnedBy(principal))
        .orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  private void reject(ClientConnection connection, String sessionId, GatewayRejectedException e) {
    STRUCTURED.logRejected(sessionId, e.code(), e.getMessage());
    try {
      if (connection.isOpen()) {
        connection.send(new ServerMessage.Error(e.getMessage()));
        connection.close(CloseCode.POLICY_VIOLATION, e.code());
      }
    } catch (IOException ioe) {
      LOGGER.debug("Could not notify rejected client: {}", ioe.getMessage());
    }
  }
}
