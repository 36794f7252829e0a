package com.scholary.relay.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TranscriptAccumulatorTest {

  private final Clock clock = Clock.fixed(Instant.parse("2025-10-04T16:17:01Z"), ZoneOffset.UTC);
  private final InMemoryTranscriptRepository repository =
      new InMemoryTranscriptRepository(100, 1, clock);
  private final TranscriptAccumulator accumulator = new TranscriptAccumulator(repository, clock);

  @Test
  void getIsSpaceJoinedFinalsInOrder() {
    accumulator.append("S1", "patient reports", 0.91, "en-IN");
    accumulator.append("S1", "mild headache", 0.88, "en-IN");
    accumulator.append("S1", "since Monday");

    assertThat(accumulator.get("S1")).isEqualTo("patient reports mild headache since Monday");
  }

  @Test
  void blankHypothesesAreIgnored() {
    accumulator.append("S1", "hello", 0.9, "en-IN");

    assertThat(accumulator.append("S1", "   ", 0.5, "en-IN")).isFalse();
    assertThat(accumulator.append("S1", null, 0.5, "en-IN")).isFalse();
    assertThat(accumulator.get("S1")).isEqualTo("hello");
    assertThat(repository.findBySessionId("S1").orElseThrow().segments()).hasSize(1);
  }

  @Test
  void textIsStrippedAndSegmentKeepsMetadata() {
    assertThat(accumulator.append("S1", " namaste ", 0.75, "hi-IN")).isTrue();

    TranscriptSegment segment = repository.findBySessionId("S1").orElseThrow().segments().get(0);
    assertThat(segment.text()).isEqualTo("namaste");
    assertThat(segment.confidence()).isEqualTo(0.75);
    assertThat(segment.languageCode()).isEqualTo("hi-IN");
    assertThat(segment.receivedAt()).isEqualTo(clock.instant());
  }

  @Test
  void sessionsAreIndependent() {
    accumulator.append("S1", "one");
    accumulator.append("S2", "two");

    assertThat(accumulator.get("S1")).isEqualTo("one");
    assertThat(accumulator.get("S2")).isEqualTo("two");
    assertThat(accumulator.get("S3")).isEmpty();
  }
}
