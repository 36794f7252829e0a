package com.scholary.relay.speech;

import java.util.Iterator;

/**
 * Interface for streaming speech recognition providers.
 *
 * <p>This abstraction keeps the relay independent of the Google client so it can be driven by a
 * scripted backend in tests.
 */
public interface SpeechRecognitionBackend {

  /**
   * Run one bidirectional streaming recognition call and block until it ends.
   *
   * <p>Requests are pulled from {@code requests} on the calling thread until it is exhausted; every
   * response is passed to {@code listener} in the order the backend emits it. Returns normally once
   * the request side is exhausted and the backend has closed the response stream.
   *
   * @param requests config element followed by audio elements
   * @param listener receives responses, and is told about transport failures that occur while the
   *     request side is still open
   * @throws UpstreamException if the backend fails
   */
  void streamingRecognize(Iterator<StreamingRequest> requests, RecognitionListener listener);

  /** Receives the response side of a streaming call. */
  interface RecognitionListener {

    void onResponse(RecognitionResponse response);

    /**
     * Called from the transport thread when the call fails before the request side is exhausted.
     * Implementations should end the request sequence so {@link #streamingRecognize} can return.
     */
    default void onTransportFailure(UpstreamException failure) {}

    /** Called when the backend ends the call on its own while the request side is still open. */
    default void onRemoteClose() {}
  }
}
