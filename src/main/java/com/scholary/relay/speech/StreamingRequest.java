package com.scholary.relay.speech;

/**
 * One element of the request side of a streaming recognition call.
 *
 * <p>A call always starts with exactly one {@link Config} followed by zero or more {@link Audio}
 * elements.
 */
public interface StreamingRequest {

  /** The initial configuration element. */
  record Config(RecognitionSettings settings) implements StreamingRequest {}

  /** A chunk of raw audio, forwarded unmodified. */
  record Audio(byte[] content) implements StreamingRequest {}
}
