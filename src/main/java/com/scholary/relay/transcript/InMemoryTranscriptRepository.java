package com.scholary.relay.transcript;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory transcript repository.
 *
 * <p>Uses a Caffeine cache so old transcripts are evicted after {@code expireAfterHours} without
 * access. Updates go through {@code asMap().compute} so concurrent appends and status changes for
 * one session never lose each other's writes.
 */
@Repository
public class InMemoryTranscriptRepository implements TranscriptRepository {

  private final Cache<String, TranscriptRecord> cache;
  private final Clock clock;

  @Autowired
  public InMemoryTranscriptRepository(
      @Value("${transcriptstore.maxSize:10000}") int maxSize,
      @Value("${transcriptstore.expireAfterHours:24}") int expireAfterHours) {
    this(maxSize, expireAfterHours, Clock.systemUTC());
  }

  InMemoryTranscriptRepository(int maxSize, int expireAfterHours, Clock clock) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofHours(expireAfterHours))
            .build();
    this.clock = clock;
  }

  @Override
  public void append(String sessionId, TranscriptSegment segment) {
    cache
        .asMap()
        .compute(
            sessionId,
            (id, existing) ->
                (existing == null ? TranscriptRecord.empty(id, clock.instant()) : existing)
                    .append(segment));
  }

  @Override
  public Optional<TranscriptRecord> findBySessionId(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId));
  }

  @Override
  public void updateStatus(String sessionId, TranscriptStatus status, String error) {
    cache
        .asMap()
        .compute(
            sessionId,
            (id, existing) ->
                (existing == null ? TranscriptRecord.empty(id, clock.instant()) : existing)
                    .withStatus(status, error, clock.instant()));
  }
}
