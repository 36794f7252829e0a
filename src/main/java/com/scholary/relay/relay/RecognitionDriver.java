package com.scholary.relay.relay;

import com.scholary.relay.logging.StructuredLogger;
import com.scholary.relay.speech.RecognitionResponse;
import com.scholary.relay.speech.SpeechRecognitionBackend;
import com.scholary.relay.speech.UpstreamException;
import com.scholary.relay.streaming.RequestGenerator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the blocking streaming recognition call on a worker thread.
 *
 * <p>The returned future completes normally when the backend has consumed the whole request
 * sequence and closed its response stream, and exceptionally with an {@link UpstreamException} on
 * any backend failure. Unexpected runtime exceptions are reported as {@link
 * UpstreamException.Kind#UNKNOWN}.
 */
public class RecognitionDriver {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecognitionDriver.class);

  private final SpeechRecognitionBackend backend;
  private final RequestGenerator requests;
  private final ResponseDispatcher dispatcher;
  private final Runnable endInput;

  /**
   * @param endInput invoked when the backend stops listening before input ends; must make the
   *     request sequence terminate
   */
  public RecognitionDriver(
      SpeechRecognitionBackend backend,
      RequestGenerator requests,
      ResponseDispatcher dispatcher,
      Runnable endInput) {
    this.backend = backend;
    this.requests = requests;
    this.dispatcher = dispatcher;
    this.endInput = endInput;
  }

  /**
   * Submit the call to {@code executor}.
   *
   * @param logContext MDC entries to install on the worker thread
   * @throws java.util.concurrent.RejectedExecutionException if the executor is saturated
   */
  public CompletableFuture<Void> start(Executor executor, Map<String, String> logContext) {
    return CompletableFuture.runAsync(() -> run(logContext), executor);
  }

  private void run(Map<String, String> logContext) {
    StructuredLogger.setRelayContext(logContext);
    long started = System.currentTimeMillis();
    try {
      LOGGER.info("Recognition call starting");
      backend.streamingRecognize(requests, new Listener(logContext));
      LOGGER.info(
          "Recognition call finished: frames={}, transcripts={}, elapsed={}ms",
          requests.audioYielded(),
          dispatcher.transcriptsSent(),
          System.currentTimeMillis() - started);
    } catch (UpstreamException e) {
      LOGGER.warn("Recognition call failed: kind={}, message={}", e.getKind(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      LOGGER.error("Recognition call failed unexpectedly", e);
      throw new UpstreamException(
          UpstreamException.Kind.UNKNOWN, "Recognition failed: " + e.getMessage(), e);
    } finally {
      StructuredLogger.clearRelayContext();
    }
  }

  /** Responses may arrive on a transport thread, so the log context is installed per call. */
  private final class Listener implements SpeechRecognitionBackend.RecognitionListener {

    private final Map<String, String> logContext;

    private Listener(Map<String, String> logContext) {
      this.logContext = logContext;
    }

    @Override
    public void onResponse(RecognitionResponse response) {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      StructuredLogger.setRelayContext(logContext);
      try {
        dispatcher.dispatch(response);
      } finally {
        if (previous == null) {
          MDC.clear();
        } else {
          MDC.setContextMap(previous);
        }
      }
    }

    @Override
    public void onTransportFailure(UpstreamException failure) {
      LOGGER.warn("Backend failed while input was open: {}", failure.getKind());
      endInput.run();
    }

    @Override
    public void onRemoteClose() {
      LOGGER.info("Backend closed the stream while input was open");
      endInput.run();
    }
  }
}
