package com.scholary.relay.transcript;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored transcript of one consultation session.
 *
 * <p>{@code text} is the space-joined text of every segment in arrival order. Records are
 * immutable; appends produce a new record.
 */
public record TranscriptRecord(
    String sessionId,
    String text,
    List<TranscriptSegment> segments,
    TranscriptStatus status,
    String error,
    Instant updatedAt) {

  public TranscriptRecord {
    segments = List.copyOf(segments);
  }

  public static TranscriptRecord empty(String sessionId, Instant now) {
    return new TranscriptRecord(sessionId, "", List.of(), TranscriptStatus.IN_PROGRESS, null, now);
  }

  TranscriptRecord append(TranscriptSegment segment) {
    String joined = text.isEmpty() ? segment.text() : text + " " + segment.text();
    List<TranscriptSegment> appended = new ArrayList<>(segments.size() + 1);
    appended.addAll(segments);
    appended.add(segment);
    return new TranscriptRecord(sessionId, joined, appended, status, error, segment.receivedAt());
  }

  TranscriptRecord withStatus(TranscriptStatus newStatus, String newError, Instant now) {
    return new TranscriptRecord(sessionId, text, segments, newStatus, newError, now);
  }
}
