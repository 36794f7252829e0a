package com.scholary.relay.transcript;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Append-only finalized text per session.
 *
 * <p>Each call to {@link #append} adds exactly one segment, space-joined with what the session
 * already has, and writes it straight through to the {@link TranscriptRepository}. Blank
 * hypotheses are ignored. Only one relay writes to a given session at a time.
 */
@Component
public class TranscriptAccumulator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptAccumulator.class);

  private final TranscriptRepository repository;
  private final Clock clock;

  @Autowired
  public TranscriptAccumulator(TranscriptRepository repository) {
    this(repository, Clock.systemUTC());
  }

  TranscriptAccumulator(TranscriptRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  public void append(String sessionId, String text) {
    append(sessionId, text, 0.0, null);
  }

  /**
   * Append one finalized hypothesis. Leading and trailing whitespace is stripped so that segments
   * join with single spaces.
   *
   * @return true if text was appended, false if it was blank
   */
  public boolean append(String sessionId, String text, double confidence, String languageCode) {
    if (text == null || text.isBlank()) {
      LOGGER.debug("Skipping blank final hypothesis for session {}", sessionId);
      return false;
    }
    Instant now = clock.instant();
    repository.append(sessionId, new TranscriptSegment(text.strip(), confidence, languageCode, now));
    return true;
  }

  public String get(String sessionId) {
    return repository.getTranscript(sessionId);
  }
}
