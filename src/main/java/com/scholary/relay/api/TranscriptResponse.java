package com.scholary.relay.api;

import com.scholary.relay.transcript.TranscriptRecord;
import com.scholary.relay.transcript.TranscriptStatus;
import java.time.Instant;

/** Finalized transcript of a session as returned by the read API. */
public record TranscriptResponse(
    String sessionId,
    String transcript,
    TranscriptStatus status,
    int segmentCount,
    Instant updatedAt,
    String error) {

  static TranscriptResponse from(TranscriptRecord record) {
    return new TranscriptResponse(
        record.sessionId(),
        record.text(),
        record.status(),
        record.segments().size(),
        record.updatedAt(),
        record.error());
  }
}
