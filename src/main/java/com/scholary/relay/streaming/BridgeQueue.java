package com.scholary.relay.streaming;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-producer / single-consumer FIFO between the WebSocket side and the recognition worker.
 *
 * <p>The producer is the connection's message callback, the consumer is the request generator
 * running on the recognition worker thread. Audio frames are bounded by {@code capacity}; when the
 * queue is full the producer waits up to {@code offerTimeout} and then gets a {@link
 * BackpressureException}. Frames are never dropped or reordered.
 *
 * <p>{@link #close()} enqueues the end marker. It is admitted regardless of capacity, happens at
 * most once, and is delivered after every frame pushed before it.
 */
public class BridgeQueue {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();

  private final ArrayDeque<byte[]> frames;
  private final int capacity;
  private final Duration offerTimeout;

  private boolean closed;
  private long pushedFrames;
  private long pushedBytes;

  public BridgeQueue(int capacity, Duration offerTimeout) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.offerTimeout = offerTimeout;
    this.frames = new ArrayDeque<>(Math.min(capacity, 64));
  }

  /**
   * Enqueue an audio frame.
   *
   * @param payload raw audio bytes, stored as given
   * @return false if the queue was already closed (the frame is discarded)
   * @throws BackpressureException if the queue stays full for longer than the offer timeout
   * @throws InterruptedException if interrupted while waiting for space
   */
  public boolean push(byte[] payload) throws InterruptedException {
    long remainingNanos = offerTimeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (!closed && frames.size() >= capacity) {
        if (remainingNanos <= 0) {
          throw new BackpressureException(
              String.format(
                  "Audio queue full (%d frames) for more than %dms",
                  capacity, offerTimeout.toMillis()));
        }
        remainingNanos = notFull.awaitNanos(remainingNanos);
      }
      if (closed) {
        return false;
      }
      frames.addLast(payload);
      pushedFrames++;
      pushedBytes += payload.length;
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Enqueue the end marker.
   *
   * @return true if this call closed the queue, false if it was already closed
   */
  public boolean close() {
    lock.lock();
    try {
      if (closed) {
        return false;
      }
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Take the next item, blocking until a frame or the end marker is available. */
  public BridgeItem pop() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (frames.isEmpty() && !closed) {
        notEmpty.await();
      }
      return takeLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Take the next item, waiting at most {@code timeout}.
   *
   * @return the next item, or null if nothing arrived in time
   */
  public BridgeItem poll(Duration timeout) throws InterruptedException {
    long remainingNanos = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (frames.isEmpty() && !closed) {
        if (remainingNanos <= 0) {
          return null;
        }
        remainingNanos = notEmpty.awaitNanos(remainingNanos);
      }
      return takeLocked();
    } finally {
      lock.unlock();
    }
  }

  private BridgeItem takeLocked() {
    byte[] payload = frames.pollFirst();
    if (payload == null) {
      return BridgeItem.END;
    }
    notFull.signal();
    return BridgeItem.audio(payload);
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return frames.size();
    } finally {
      lock.unlock();
    }
  }

  public long pushedFrames() {
    lock.lock();
    try {
      return pushedFrames;
    } finally {
      lock.unlock();
    }
  }

  public long pushedBytes() {
    lock.lock();
    try {
      return pushedBytes;
    } finally {
      lock.unlock();
    }
  }
}
