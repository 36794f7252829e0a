package com.scholary.relay.speech;

import java.util.List;

/**
 * Backend-neutral view of one streaming recognition response.
 *
 * <p>A response may carry a voice-activity event, transcript results, or both.
 */
public record RecognitionResponse(SpeechEvent speechEvent, List<Result> results) {

  public RecognitionResponse {
    speechEvent = speechEvent == null ? SpeechEvent.NONE : speechEvent;
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static RecognitionResponse event(SpeechEvent speechEvent) {
    return new RecognitionResponse(speechEvent, List.of());
  }

  public static RecognitionResponse result(String transcript, double confidence, boolean isFinal) {
    return new RecognitionResponse(
        SpeechEvent.NONE,
        List.of(new Result(List.of(new Alternative(transcript, confidence)), isFinal, null)));
  }

  /** Voice-activity signal reported by the backend. */
  public enum SpeechEvent {
    NONE,
    ACTIVITY_BEGIN,
    ACTIVITY_END
  }

  /** One transcript result; alternatives are ordered best first. */
  public record Result(List<Alternative> alternatives, boolean isFinal, String languageCode) {

    public Result {
      alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }
  }

  /** Confidence is in [0, 1]; 0 when the backend does not report one. */
  public record Alternative(String transcript, double confidence) {}
}
