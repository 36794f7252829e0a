package com.scholary.relay.relay;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.relay.protocol.ServerMessage;
import com.scholary.relay.speech.RecognitionResponse;
import com.scholary.relay.speech.RecognitionResponse.Alternative;
import com.scholary.relay.speech.RecognitionResponse.Result;
import com.scholary.relay.speech.RecognitionResponse.SpeechEvent;
import com.scholary.relay.transcript.InMemoryTranscriptRepository;
import com.scholary.relay.transcript.TranscriptAccumulator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResponseDispatcherTest {

  private final List<ServerMessage> sent = new ArrayList<>();
  private final TranscriptAccumulator accumulator =
      new TranscriptAccumulator(new InMemoryTranscriptRepository(100, 1));
  private final ResponseDispatcher dispatcher = new ResponseDispatcher("S1", sent::add, accumulator);

  @Test
  void voiceActivityEventsBecomeVadMessages() {
    dispatcher.dispatch(RecognitionResponse.event(SpeechEvent.ACTIVITY_BEGIN));
    dispatcher.dispatch(RecognitionResponse.event(SpeechEvent.ACTIVITY_END));

    assertThat(sent)
        .containsExactly(
            new ServerMessage.VadEvent("speech_start", "Speech detected"),
            new ServerMessage.VadEvent("speech_end", "Speech ended"));
    assertThat(dispatcher.transcriptsSent()).isZero();
  }

  @Test
  void onlyFinalsAreAppended() {
    dispatcher.dispatch(RecognitionResponse.result("hel", 0.3, false));
    dispatcher.dispatch(RecognitionResponse.result("hello", 0.9, true));

    assertThat(sent)
        .containsExactly(
            new ServerMessage.Transcript("hel", false, 0.3),
            new ServerMessage.Transcript("hello", true, 0.9));
    assertThat(accumulator.get("S1")).isEqualTo("hello");
    assertThat(dispatcher.transcriptsSent()).isEqualTo(2);
    assertThat(dispatcher.finalsAppended()).isEqualTo(1);
  }

  @Test
  void usesTopAlternativeOfEachResult() {
    dispatcher.dispatch(
        new RecognitionResponse(
            SpeechEvent.NONE,
            List.of(
                new Result(
                    List.of(new Alternative("blood pressure", 0.8), new Alternative("blood", 0.2)),
                    true,
                    "en-in"),
                new Result(List.of(), false, "en-in"),
                new Result(List.of(new Alternative("normal", 0.7)), true, "en-in"))));

    assertThat(sent)
        .containsExactly(
            new ServerMessage.Transcript("blood pressure", true, 0.8),
            new ServerMessage.Transcript("normal", true, 0.7));
    assertThat(accumulator.get("S1")).isEqualTo("blood pressure normal");
  }

  @Test
  void eventAndResultInOneResponseAreBothDelivered() {
    dispatcher.dispatch(
        new RecognitionResponse(
            SpeechEvent.ACTIVITY_END,
            List.of(new Result(List.of(new Alternative("done", 0.9)), true, null))));

    assertThat(sent)
        .containsExactly(
            ServerMessage.VadEvent.speechEnd(), new ServerMessage.Transcript("done", true, 0.9));
  }

  @Test
  void blankFinalIsSentButNotAppended() {
    dispatcher.dispatch(RecognitionResponse.result("", 0.0, true));

    assertThat(sent).hasSize(1);
    assertThat(dispatcher.finalsAppended()).isZero();
    assertThat(accumulator.get("S1")).isEmpty();
  }
}
