package com.scholary.relay.transcript;

import java.util.Optional;

/**
 * Durable store for per-session transcripts.
 *
 * <p>Read after a session ends by report generation, so it must outlive any single relay.
 */
public interface TranscriptRepository {

  /** Append one finalized segment, creating the record if the session has none yet. */
  void append(String sessionId, TranscriptSegment segment);

  Optional<TranscriptRecord> findBySessionId(String sessionId);

  /** Record the outcome of a relay; creates an empty record if none exists. */
  void updateStatus(String sessionId, TranscriptStatus status, String error);

  /** Finalized text for the session, empty if nothing has been transcribed. */
  default String getTranscript(String sessionId) {
    return findBySessionId(sessionId).map(TranscriptRecord::text).orElse("");
  }
}
