package com.scholary.relay.transcript;

/** Lifecycle of a session's transcript as seen by the last relay that wrote to it. */
public enum TranscriptStatus {
  IN_PROGRESS,
  COMPLETED,
  PAUSED,
  FAILED
}
