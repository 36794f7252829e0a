package com.scholary.relay.transcript;

import java.time.Instant;

/** One finalized hypothesis as appended to a session transcript. */
public record TranscriptSegment(
    String text, double confidence, String languageCode, Instant receivedAt) {}
