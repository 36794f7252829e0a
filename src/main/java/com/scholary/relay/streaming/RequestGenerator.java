package com.scholary.relay.streaming;

import com.scholary.relay.speech.RecognitionSettings;
import com.scholary.relay.speech.StreamingRequest;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-based request sequence for one streaming recognition call.
 *
 * <p>Yields the configuration element first, then one audio element per frame taken from the
 * {@link BridgeQueue}, and ends when the queue's end marker is reached. The sequence is lazy,
 * finite and single-use; {@link #hasNext()} blocks the calling (worker) thread while waiting for
 * audio.
 *
 * <p>If {@code idleTimeout} is non-zero and no frame arrives within it, the sequence ends early and
 * {@link #idleTimedOut()} reports it. Frames the client sent but that never reached the queue (audio
 * discarded while paused) count as activity when a {@code lastClientFrame} clock is supplied.
 */
public class RequestGenerator implements Iterator<StreamingRequest> {

  private static final Logger LOGGER = LoggerFactory.getLogger(RequestGenerator.class);

  private static final int PROGRESS_LOG_INTERVAL = 50;

  private final RecognitionSettings settings;
  private final BridgeQueue queue;
  private final Duration idleTimeout;
  private final LongSupplier lastClientFrame;

  private long lastItemAt = System.nanoTime();
  private boolean configYielded;
  private boolean finished;
  private StreamingRequest lookahead;

  private long audioYielded;
  private long bytesYielded;
  private volatile boolean idleTimedOut;
  private volatile boolean interrupted;

  public RequestGenerator(RecognitionSettings settings, BridgeQueue queue, Duration idleTimeout) {
    this(settings, queue, idleTimeout, null);
  }

  /**
   * @param lastClientFrame {@link System#nanoTime()} of the last frame the client sent, or null to
   *     measure idleness from the queue alone
   */
  public RequestGenerator(
      RecognitionSettings settings,
      BridgeQueue queue,
      Duration idleTimeout,
      LongSupplier lastClientFrame) {
    this.settings = settings;
    this.queue = queue;
    this.idleTimeout = idleTimeout;
    this.lastClientFrame = lastClientFrame;
  }

  @Override
  public boolean hasNext() {
    if (!configYielded || lookahead != null) {
      return true;
    }
    if (finished) {
      return false;
    }

    BridgeItem item;
    try {
      item = idleTimeout.isZero() ? queue.pop() : pollUntilIdle();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      interrupted = true;
      finished = true;
      LOGGER.warn("Request stream interrupted after {} audio frames", audioYielded);
      return false;
    }

    if (item == null) {
      idleTimedOut = true;
      finished = true;
      LOGGER.warn(
          "No audio received for {}s, ending request stream after {} frames",
          idleTimeout.toSeconds(),
          audioYielded);
      return false;
    }
    if (item.isEnd()) {
      finished = true;
      LOGGER.info(
          "Request stream completed: {} audio frames, {} bytes", audioYielded, bytesYielded);
      return false;
    }

    lookahead = new StreamingRequest.Audio(item.payload());
    return true;
  }

  /** Returns null once neither the queue nor the client has produced a frame for the timeout. */
  private BridgeItem pollUntilIdle() throws InterruptedException {
    long timeoutNanos = idleTimeout.toNanos();
    while (true) {
      long now = System.nanoTime();
      long idleFor = now - lastItemAt;
      if (lastClientFrame != null) {
        idleFor = Math.min(idleFor, now - lastClientFrame.getAsLong());
      }
      long remaining = timeoutNanos - idleFor;
      if (remaining <= 0) {
        return null;
      }
      BridgeItem item = queue.poll(Duration.ofNanos(remaining));
      if (item != null) {
        lastItemAt = System.nanoTime();
        return item;
      }
    }
  }

  @Override
  public StreamingRequest next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Request stream has ended");
    }
    if (!configYielded) {
      configYielded = true;
      LOGGER.debug("Yielding recognition config: {}", settings);
      return new StreamingRequest.Config(settings);
    }

    StreamingRequest.Audio audio = (StreamingRequest.Audio) lookahead;
    lookahead = null;
    audioYielded++;
    bytesYielded += audio.content().length;
    if (audioYielded % PROGRESS_LOG_INTERVAL == 0) {
      LOGGER.info("Streamed {} audio frames ({} bytes) to recognizer", audioYielded, bytesYielded);
    }
    return audio;
  }

  public long audioYielded() {
    return audioYielded;
  }

  public boolean idleTimedOut() {
    return idleTimedOut;
  }

  public boolean interrupted() {
    return interrupted;
  }
}
