package com.scholary.relay.relay;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Live relays keyed by session id.
 *
 * <p>At most one relay may stream a given session at a time; a second connection for the same
 * session is refused until the first has closed.
 */
@Component
public class RelayRegistry {

  private final Map<String, StreamingRelay> active = new ConcurrentHashMap<>();

  /** Claim the session for {@code relay}. Returns false if another relay already holds it. */
  public boolean reserve(StreamingRelay relay) {
    return active.putIfAbsent(relay.sessionId(), relay) == null;
  }

  /** Release the session if {@code relay} still holds it. */
  public boolean release(StreamingRelay relay) {
    return active.remove(relay.sessionId(), relay);
  }

  public Optional<StreamingRelay> find(String sessionId) {
    return Optional.ofNullable(active.get(sessionId));
  }

  public int activeCount() {
    return active.size();
  }
}
