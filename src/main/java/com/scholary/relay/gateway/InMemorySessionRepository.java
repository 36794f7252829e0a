package com.scholary.relay.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory session store.
 *
 * <p>Sessions are normally created by the consultation service; this store is seeded through
 * {@link #save} and evicts entries after a period without writes.
 */
@Repository
public class InMemorySessionRepository implements SessionRepository {

  private final Cache<String, ConsultationSession> cache;

  public InMemorySessionRepository(
      @Value("${sessionstore.maxSize:10000}") int maxSize,
      @Value("${sessionstore.expireAfterHours:24}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  @Override
  public void save(ConsultationSession session) {
    cache.put(session.id(), session);
  }

  @Override
  public Optional<ConsultationSession> findById(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId));
  }
}
