package com.scholary.relay.relay;

import com.scholary.relay.logging.StructuredLogger;
import com.scholary.relay.protocol.ClientConnection;
import com.scholary.relay.protocol.CloseCode;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.protocol.ServerMessage;
import com.scholary.relay.speech.RecognitionSettings;
import com.scholary.relay.speech.SpeechRecognitionBackend;
import com.scholary.relay.speech.UpstreamException;
import com.scholary.relay.streaming.BackpressureException;
import com.scholary.relay.streaming.BridgeQueue;
import com.scholary.relay.streaming.IdleTimeoutException;
import com.scholary.relay.streaming.RequestGenerator;
import com.scholary.relay.transcript.TranscriptAccumulator;
import com.scholary.relay.transcript.TranscriptRepository;
import com.scholary.relay.transcript.TranscriptStatus;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live client connection bridged to one streaming recognition call.
 *
 * <p>Owns the bridge queue, the request generator, the recognition driver and the response
 * dispatcher, and coordinates their shutdown. Every exit path (client stop, client disconnect,
 * backend failure, backpressure, idle timeout) ends in one finish step, which runs once: it records
 * the transcript outcome, releases the session, sends either a completion message or at most one
 * error message, and closes the connection at most once.
 *
 * <p>Thread model: {@link AudioIngress} runs on the connection's message thread, the recognition
 * call runs on a worker, and responses may be dispatched on a transport thread. State changes go
 * through compare-and-set so that concurrent exits cannot both win.
 */
public class StreamingRelay {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamingRelay.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final String relayId;
  private final String sessionId;
  private final String principalId;
  private final ClientConnection connection;
  private final BridgeQueue queue;
  private final RequestGenerator requests;
  private final ResponseDispatcher dispatcher;
  private final RecognitionDriver driver;
  private final AudioIngress ingress;
  private final TranscriptRepository transcripts;
  private final Duration idleTimeout;
  private final Consumer<StreamingRelay> onClosed;

  private final AtomicReference<RelayState> state =
      new AtomicReference<>(RelayState.CONNECTING);
  private final AtomicReference<Throwable> failure = new AtomicReference<>();
  private final AtomicBoolean finished = new AtomicBoolean();
  private final CompletableFuture<TranscriptStatus> closed = new CompletableFuture<>();
  private final long createdAt = System.currentTimeMillis();

  private volatile boolean clientGone;
  private volatile boolean interruptedByClient;

  StreamingRelay(
      String relayId,
      String sessionId,
      String principalId,
      ClientConnection connection,
      BridgeQueue queue,
      RecognitionSettings settings,
      Duration idleTimeout,
      SpeechRecognitionBackend backend,
      TranscriptAccumulator accumulator,
      TranscriptRepository transcripts,
      MessageCodec codec,
      Consumer<StreamingRelay> onClosed) {
    this.relayId = relayId;
    this.sessionId = sessionId;
    this.principalId = principalId;
    this.connection = connection;
    this.queue = queue;
    this.transcripts = transcripts;
    this.idleTimeout = idleTimeout;
    this.onClosed = onClosed;
    this.ingress = new AudioIngress(this, queue, codec);
    this.requests = new RequestGenerator(settings, queue, idleTimeout, ingress::lastFrameAt);
    this.dispatcher = new ResponseDispatcher(sessionId, this::deliver, accumulator);
    this.driver = new RecognitionDriver(backend, requests, dispatcher, this::endInput);
  }

  /** Called by the gateway once the credential and session checks have passed. */
  public void markAuthenticated() {
    transition(RelayState.CONNECTING, RelayState.AUTHENTICATED);
  }

  /**
   * Start the recognition call. If the worker pool refuses the call the relay fails with {@link
   * CapacityExceededException} and closes the connection with {@link CloseCode#TRY_AGAIN_LATER}.
   */
  public void start(Executor executor) {
    if (!transition(RelayState.AUTHENTICATED, RelayState.STREAMING)) {
      throw new IllegalStateException("Relay cannot start from state " + state.get());
    }
    transcripts.updateStatus(sessionId, TranscriptStatus.IN_PROGRESS, null);

    CompletableFuture<Void> running;
    try {
      running = driver.start(executor, logContext());
    } catch (RejectedExecutionException e) {
      fail(new CapacityExceededException("Transcription capacity exhausted, try again later", e));
      finish();
      return;
    }
    running.whenComplete((ignored, error) -> onDriverFinished(error));
  }

  /** Client asked to stop: end the input and let the backend drain. A second call is a no-op. */
  public boolean stop(String reason) {
    if (!transition(RelayState.STREAMING, RelayState.STOPPING)) {
      LOGGER.debug("Ignoring stop ({}) in state {}", reason, state.get());
      return false;
    }
    LOGGER.info("Stopping relay: {}", reason);
    endInput();
    return true;
  }

  /** Record the first failure and move to FAILED. Later failures are logged and dropped. */
  public void fail(Throwable cause) {
    if (!failure.compareAndSet(null, cause)) {
      LOGGER.debug("Additional failure after first: {}", cause.toString());
      return;
    }
    STRUCTURED.logFailure(sessionId, cause.getClass().getSimpleName(), cause.getMessage());
    moveToFailed();
    endInput();
  }

  /**
   * The client went away: nothing more can be sent, but the backend is allowed to drain. The
   * transcript is left PAUSED only if the disconnect interrupted streaming; after a stop it
   * completes normally.
   */
  public void onClientDisconnected() {
    clientGone = true;
    if (transition(RelayState.STREAMING, RelayState.STOPPING)) {
      interruptedByClient = true;
      LOGGER.info("Client disconnected while streaming");
    }
    endInput();
  }

  /**
   * The client went away before streaming started. Closes the relay without running the
   * recognition call and leaves the transcript PAUSED.
   */
  public void abort(String reason) {
    RelayState current = state.get();
    if (current != RelayState.CONNECTING && current != RelayState.AUTHENTICATED) {
      onClientDisconnected();
      return;
    }
    LOGGER.info("Aborting relay in state {}: {}", current, reason);
    clientGone = true;
    interruptedByClient = true;
    endInput();
    finish();
  }

  /** Send a message to the client while the relay is delivering; dropped otherwise. */
  void deliver(ServerMessage message) {
    RelayState current = state.get();
    if (!current.isDelivering()) {
      LOGGER.debug("Dropping {} in state {}", message.getClass().getSimpleName(), current);
      return;
    }
    sendQuietly(message);
  }

  private void endInput() {
    if (queue.close()) {
      LOGGER.debug("Input closed after {} frames", queue.pushedFrames());
    }
  }

  private void onDriverFinished(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    if (cause != null) {
      fail(cause);
    } else if (requests.idleTimedOut()) {
      fail(new IdleTimeoutException(
          "No audio received for " + idleTimeout.toSeconds() + " seconds"));
    } else if (transition(RelayState.STREAMING, RelayState.STOPPING)) {
      LOGGER.info("Backend ended the stream before the client stopped");
    }
    endInput();
    finish();
  }

  private void finish() {
    if (!finished.compareAndSet(false, true)) {
      return;
    }

    Throwable cause = failure.get();
    TranscriptStatus outcome = outcome(cause);
    try {
      transcripts.updateStatus(sessionId, outcome, cause == null ? null : describe(cause));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to record transcript status {}", outcome, e);
    }

    RelayState last = state.getAndSet(RelayState.CLOSED);
    STRUCTURED.logStateChange(sessionId, last.name(), RelayState.CLOSED.name());

    // the session is released before the client sees the close, so it can reconnect at once
    try {
      onClosed.accept(this);
    } catch (RuntimeException e) {
      LOGGER.error("Relay close hook failed", e);
    }

    CloseCode code = CloseCode.NORMAL;
    String reason = "Transcription finished";
    if (outcome == TranscriptStatus.COMPLETED) {
      String fullTranscript = transcripts.getTranscript(sessionId);
      sendQuietly(ServerMessage.Completed.of(dispatcher.transcriptsSent(), fullTranscript));
    } else if (cause != null) {
      sendQuietly(new ServerMessage.Error(describe(cause)));
      code = cause instanceof CapacityExceededException
          ? CloseCode.TRY_AGAIN_LATER
          : CloseCode.SERVER_ERROR;
      reason = code == CloseCode.TRY_AGAIN_LATER ? "Try again later" : "Transcription failed";
    }
    closeConnection(code, reason);

    STRUCTURED.logClosed(
        sessionId,
        outcome.name(),
        queue.pushedFrames(),
        queue.pushedBytes(),
        dispatcher.transcriptsSent(),
        dispatcher.finalsAppended(),
        System.currentTimeMillis() - createdAt);
    closed.complete(outcome);
  }

  private TranscriptStatus outcome(Throwable cause) {
    if (cause != null) {
      return TranscriptStatus.FAILED;
    }
    return interruptedByClient ? TranscriptStatus.PAUSED : TranscriptStatus.COMPLETED;
  }

  private void closeConnection(CloseCode code, String reason) {
    if (clientGone || !connection.isOpen()) {
      return;
    }
    try {
      connection.close(code, reason);
    } catch (IOException | IllegalStateException e) {
      LOGGER.debug("Close of connection {} failed: {}", connection.id(), e.toString());
    }
  }

  private boolean sendQuietly(ServerMessage message) {
    if (clientGone || !connection.isOpen()) {
      return false;
    }
    try {
      connection.send(message);
      return true;
    } catch (IOException | IllegalStateException e) {
      LOGGER.debug("Send to connection {} failed: {}", connection.id(), e.toString());
      return false;
    }
  }

  /** Message shown to the client; backend internals are not leaked. */
  static String describe(Throwable cause) {
    if (cause instanceof UpstreamException upstream) {
      return switch (upstream.getKind()) {
        case QUOTA_EXCEEDED -> "Speech recognition quota exceeded";
        case INVALID_ARGUMENT -> "Speech recognition rejected the audio stream";
        case UNAVAILABLE -> "Speech recognition service unavailable";
        case DEADLINE_EXCEEDED -> "Speech recognition timed out";
        case TRANSPORT, UNKNOWN -> "Transcription service error";
      };
    }
    if (cause instanceof BackpressureException
        || cause instanceof IdleTimeoutException
        || cause instanceof CapacityExceededException) {
      return cause.getMessage();
    }
    return "Internal server error";
  }

  private void moveToFailed() {
    while (true) {
      RelayState current = state.get();
      if (!current.canTransitionTo(RelayState.FAILED)) {
        return;
      }
      if (state.compareAndSet(current, RelayState.FAILED)) {
        STRUCTURED.logStateChange(sessionId, current.name(), RelayState.FAILED.name());
        return;
      }
    }
  }

  private boolean transition(RelayState from, RelayState to) {
    if (!from.canTransitionTo(to) || !state.compareAndSet(from, to)) {
      return false;
    }
    STRUCTURED.logStateChange(sessionId, from.name(), to.name());
    return true;
  }

  Map<String, String> logContext() {
    Map<String, String> context = new LinkedHashMap<>();
    context.put(StructuredLogger.SESSION_ID, sessionId);
    context.put(StructuredLogger.RELAY_ID, relayId);
    if (principalId != null) {
      context.put(StructuredLogger.PRINCIPAL_ID, principalId);
    }
    return context;
  }

  public String relayId() {
    return relayId;
  }

  public String sessionId() {
    return sessionId;
  }

  public String principalId() {
    return principalId;
  }

  public RelayState state() {
    return state.get();
  }

  public AudioIngress ingress() {
    return ingress;
  }

  /** First failure recorded, or null. */
  public Throwable failure() {
    return failure.get();
  }

  /** Completes with the recorded transcript outcome once the relay is fully closed. */
  public CompletableFuture<TranscriptStatus> closedFuture() {
    return closed;
  }
}
