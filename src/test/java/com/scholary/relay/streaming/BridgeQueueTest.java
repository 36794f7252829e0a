package com.scholary.relay.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class BridgeQueueTest {

  @Test
  void popReturnsFramesInPushOrderThenEnd() throws Exception {
    BridgeQueue queue = new BridgeQueue(8, Duration.ofMillis(100));
    queue.push(new byte[] {1});
    queue.push(new byte[] {2});
    queue.push(new byte[] {3});
    queue.close();

    assertThat(queue.pop().payload()).containsExactly(1);
    assertThat(queue.pop().payload()).containsExactly(2);
    assertThat(queue.pop().payload()).containsExactly(3);
    assertThat(queue.pop().isEnd()).isTrue();
    assertThat(queue.pop().isEnd()).isTrue();
  }

  @Test
  void closeOnlyTakesEffectOnce() {
    BridgeQueue queue = new BridgeQueue(8, Duration.ofMillis(100));

    assertThat(queue.close()).isTrue();
    assertThat(queue.close()).isFalse();
    assertThat(queue.isClosed()).isTrue();
  }

  @Test
  void pushAfterCloseIsDiscarded() throws Exception {
    BridgeQueue queue = new BridgeQueue(8, Duration.ofMillis(100));
    queue.close();

    assertThat(queue.push(new byte[] {9})).isFalse();
    assertThat(queue.size()).isZero();
    assertThat(queue.pushedFrames()).isZero();
  }

  @Test
  void endMarkerIsAdmittedWhenFull() throws Exception {
    BridgeQueue queue = new BridgeQueue(1, Duration.ofMillis(10));
    queue.push(new byte[] {1});

    assertThat(queue.close()).isTrue();
    assertThat(queue.pop().payload()).containsExactly(1);
    assertThat(queue.pop().isEnd()).isTrue();
  }

  @Test
  void fullQueueFailsProducerAfterOfferTimeout() throws Exception {
    BridgeQueue queue = new BridgeQueue(2, Duration.ofMillis(50));
    queue.push(new byte[] {1});
    queue.push(new byte[] {2});

    assertThatThrownBy(() -> queue.push(new byte[] {3}))
        .isInstanceOf(BackpressureException.class)
        .hasMessageContaining("2 frames");
    assertThat(queue.size()).isEqualTo(2);
  }

  @Test
  void blockedProducerResumesWhenConsumerTakesAFrame() throws Exception {
    BridgeQueue queue = new BridgeQueue(1, Duration.ofSeconds(5));
    queue.push(new byte[] {1});

    CompletableFuture<Boolean> pushed =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return queue.push(new byte[] {2});
              } catch (InterruptedException e) {
                throw new IllegalStateException(e);
              }
            });

    assertThat(queue.pop().payload()).containsExactly(1);
    assertThat(pushed.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(queue.pop().payload()).containsExactly(2);
  }

  @Test
  void pollReturnsNullWhenNothingArrives() throws Exception {
    BridgeQueue queue = new BridgeQueue(4, Duration.ofMillis(100));

    assertThat(queue.poll(Duration.ofMillis(20))).isNull();
  }

  @Test
  void popUnblocksOnClose() throws Exception {
    BridgeQueue queue = new BridgeQueue(4, Duration.ofMillis(100));
    CompletableFuture<BridgeItem> popped =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return queue.pop();
              } catch (InterruptedException e) {
                throw new IllegalStateException(e);
              }
            });

    queue.close();

    assertThat(popped.get(5, TimeUnit.SECONDS).isEnd()).isTrue();
  }

  @Test
  void countsFramesAndBytes() throws Exception {
    BridgeQueue queue = new BridgeQueue(4, Duration.ofMillis(100));
    queue.push(new byte[1365]);
    queue.push(new byte[100]);

    assertThat(queue.pushedFrames()).isEqualTo(2);
    assertThat(queue.pushedBytes()).isEqualTo(1465);
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new BridgeQueue(0, Duration.ofMillis(10)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
