package com.scholary.relay.speech;

/**
 * Exception thrown when the speech recognition backend fails.
 *
 * <p>The {@link Kind} is derived from the transport status so callers can log and report failures
 * without depending on gRPC types.
 */
public class UpstreamException extends RuntimeException {

  /** Failure classification. */
  public enum Kind {
    QUOTA_EXCEEDED,
    INVALID_ARGUMENT,
    UNAVAILABLE,
    DEADLINE_EXCEEDED,
    TRANSPORT,
    UNKNOWN
  }

  private final Kind kind;

  public UpstreamException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public UpstreamException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
