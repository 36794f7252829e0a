package com.scholary.relay.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Messages sent from the relay to the client, serialized as JSON with a {@code type} tag.
 *
 * <pre>
 * {"type":"connected","session_id":"S1","message":"Transcription service ready"}
 * {"type":"vad_event","event":"speech_start","message":"Speech detected"}
 * {"type":"transcript","transcript":"hello","is_final":true,"confidence":0.93}
 * {"type":"completed","message":"Transcription finished successfully","total_responses":2,
 *  "full_transcript":"hello"}
 * {"type":"error","message":"Speech backend quota exceeded"}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ServerMessage.Connected.class, name = "connected"),
  @JsonSubTypes.Type(value = ServerMessage.VadEvent.class, name = "vad_event"),
  @JsonSubTypes.Type(value = ServerMessage.Transcript.class, name = "transcript"),
  @JsonSubTypes.Type(value = ServerMessage.Completed.class, name = "completed"),
  @JsonSubTypes.Type(value = ServerMessage.Error.class, name = "error")
})
public interface ServerMessage {

  /** Acknowledges a successfully admitted connection. */
  @JsonTypeName("connected")
  record Connected(@JsonProperty("session_id") String sessionId, String message)
      implements ServerMessage {

    public static Connected ready(String sessionId) {
      return new Connected(sessionId, "Transcription service ready");
    }
  }

  /** Voice-activity signal forwarded from the backend. */
  @JsonTypeName("vad_event")
  record VadEvent(String event, String message) implements ServerMessage {

    public static final String SPEECH_START = "speech_start";
    public static final String SPEECH_END = "speech_end";

    public static VadEvent speechStart() {
      return new VadEvent(SPEECH_START, "Speech detected");
    }

    public static VadEvent speechEnd() {
      return new VadEvent(SPEECH_END, "Speech ended");
    }
  }

  /** An interim or final transcript hypothesis. */
  @JsonTypeName("transcript")
  record Transcript(
      String transcript, @JsonProperty("is_final") boolean isFinal, double confidence)
      implements ServerMessage {}

  /** Sent once before a normal close; carries the session's accumulated transcript. */
  @JsonTypeName("completed")
  record Completed(
      String message,
      @JsonProperty("total_responses") long totalResponses,
      @JsonProperty("full_transcript") String fullTranscript)
      implements ServerMessage {

    public static Completed of(long totalResponses, String fullTranscript) {
      return new Completed("Transcription finished successfully", totalResponses, fullTranscript);
    }
  }

  /** A terminal failure; at most one is sent per connection. */
  @JsonTypeName("error")
  record Error(String message) implements ServerMessage {}
}
