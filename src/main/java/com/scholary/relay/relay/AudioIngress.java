package com.scholary.relay.relay;

import com.scholary.relay.protocol.ControlMessage;
import com.scholary.relay.protocol.MalformedControlMessageException;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.streaming.BackpressureException;
import com.scholary.relay.streaming.BridgeQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side half of a relay: handles every frame the client sends.
 *
 * <p>Binary frames are raw audio and go onto the bridge queue unmodified and in arrival order.
 * Text frames are control messages: {@code stop} ends the input, {@code pause} and {@code resume}
 * toggle whether audio is forwarded (audio received while paused is discarded). Malformed text
 * frames are logged and ignored. Called only from the connection's message thread.
 *
 * <p>Every non-empty frame, forwarded or discarded, moves the last-frame clock that the idle
 * timeout is measured against, so a paused client that keeps sending audio is not idle.
 */
public class AudioIngress {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioIngress.class);

  private final StreamingRelay relay;
  private final BridgeQueue queue;
  private final MessageCodec codec;

  private volatile boolean paused;
  private volatile long lastFrameAt = System.nanoTime();
  private long discardedFrames;

  AudioIngress(StreamingRelay relay, BridgeQueue queue, MessageCodec codec) {
    this.relay = relay;
    this.queue = queue;
    this.codec = codec;
  }

  public void onAudio(byte[] payload) {
    if (payload.length == 0) {
      LOGGER.debug("Skipping empty audio frame");
      return;
    }
    lastFrameAt = System.nanoTime();
    if (relay.state() != RelayState.STREAMING) {
      LOGGER.debug("Dropping {} byte frame in state {}", payload.length, relay.state());
      return;
    }
    if (paused) {
      discardedFrames++;
      return;
    }

    try {
      if (!queue.push(payload)) {
        LOGGER.debug("Dropping {} byte frame after end of input", payload.length);
      }
    } catch (BackpressureException e) {
      relay.fail(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      relay.fail(new IllegalStateException("Interrupted while queueing audio", e));
    }
  }

  public void onControl(String text) {
    ControlMessage message;
    try {
      message = codec.parseControl(text);
    } catch (MalformedControlMessageException e) {
      LOGGER.warn("Ignoring control message: {}", e.getMessage());
      return;
    }

    switch (message) {
      case STOP -> relay.stop("client requested stop");
      case PAUSE -> pause();
      case RESUME -> resume();
    }
  }

  public void onDisconnect() {
    relay.onClientDisconnected();
  }

  private void pause() {
    if (relay.state() != RelayState.STREAMING || paused) {
      LOGGER.debug("Ignoring pause in state {}, paused={}", relay.state(), paused);
      return;
    }
    paused = true;
    LOGGER.info("Audio forwarding paused");
  }

  private void resume() {
    if (relay.state() != RelayState.STREAMING || !paused) {
      LOGGER.debug("Ignoring resume in state {}, paused={}", relay.state(), paused);
      return;
    }
    paused = false;
    LOGGER.info("Audio forwarding resumed, {} frames discarded while paused", discardedFrames);
  }

  public boolean isPaused() {
    return paused;
  }

  /** {@link System#nanoTime()} of the last non-empty frame received from the client. */
  public long lastFrameAt() {
    return lastFrameAt;
  }

  public long discardedFrames() {
    return discardedFrames;
  }
}
