package com.scholary.relay.logging;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log relay events with structured fields that can be queried in the log
 * index. Relay context ({@code sessionId}, {@code relayId}, {@code principalId}) is set per thread
 * with {@link #setRelayContext} and must be cleared by the same thread.
 */
public class StructuredLogger {

  public static final String SESSION_ID = "sessionId";
  public static final String RELAY_ID = "relayId";
  public static final String PRINCIPAL_ID = "principalId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a relay state transition. */
  public void logStateChange(String sessionId, String from, String to) {
    try {
      MDC.put("event_type", "relay_state");
      MDC.put("fromState", from);
      MDC.put("toState", to);

      logger.info("Relay state: session={}, {} -> {}", sessionId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a connection refused by the gateway. */
  public void logRejected(String sessionId, String errorCode, String message) {
    try {
      MDC.put("event_type", "relay_rejected");
      MDC.put("errorCode", errorCode);

      logger.warn(
          "Connection rejected: session={}, code={}, reason={}", sessionId, errorCode, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a terminal relay failure. */
  public void logFailure(String sessionId, String errorType, String message) {
    try {
      MDC.put("event_type", "relay_failed");
      MDC.put("errorType", errorType);

      logger.error("Relay failed: session={}, error={}, message={}", sessionId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the end of a relay with its counters. */
  public void logClosed(
      String sessionId,
      String finalState,
      long audioFrames,
      long audioBytes,
      long transcriptsSent,
      long finalsAppended,
      long durationMs) {
    try {
      MDC.put("event_type", "relay_closed");
      MDC.put("finalState", finalState);
      MDC.put("audioFrames", String.valueOf(audioFrames));
      MDC.put("audioBytes", String.valueOf(audioBytes));
      MDC.put("transcriptsSent", String.valueOf(transcriptsSent));
      MDC.put("finalsAppended", String.valueOf(finalsAppended));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Relay closed: session={}, outcome={}, frames={}, bytes={}, transcripts={}, finals={},"
              + " duration={}ms",
          sessionId,
          finalState,
          audioFrames,
          audioBytes,
          transcriptsSent,
          finalsAppended,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set relay context in MDC. */
  public static void setRelayContext(String sessionId, String relayId, String principalId) {
    MDC.put(SESSION_ID, sessionId);
    MDC.put(RELAY_ID, relayId);
    if (principalId != null) {
      MDC.put(PRINCIPAL_ID, principalId);
    }
  }

  /** Set relay context in MDC from a map captured on another thread. */
  public static void setRelayContext(Map<String, String> context) {
    context.forEach(MDC::put);
  }

  /** Clear relay context from MDC. */
  public static void clearRelayContext() {
    MDC.remove(SESSION_ID);
    MDC.remove(RELAY_ID);
    MDC.remove(PRINCIPAL_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("errorCode");
    MDC.remove("errorType");
    MDC.remove("finalState");
    MDC.remove("audioFrames");
    MDC.remove("audioBytes");
    MDC.remove("transcriptsSent");
    MDC.remove("finalsAppended");
    MDC.remove("durationMs");
  }
}
