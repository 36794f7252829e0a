package com.scholary.relay.relay;

import com.scholary.relay.protocol.ServerMessage;
import com.scholary.relay.speech.RecognitionResponse;
import com.scholary.relay.speech.RecognitionResponse.Alternative;
import com.scholary.relay.speech.RecognitionResponse.Result;
import com.scholary.relay.transcript.TranscriptAccumulator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns backend responses into client messages.
 *
 * <p>Voice-activity events become {@code vad_event} messages; each result with at least one
 * alternative becomes a {@code transcript} message built from the top alternative. Final results
 * are also appended to the session transcript. Responses are handled strictly in the order
 * received, with no reordering or deduplication.
 */
public class ResponseDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResponseDispatcher.class);

  private final String sessionId;
  private final Consumer<ServerMessage> client;
  private final TranscriptAccumulator accumulator;

  private final AtomicLong transcriptsSent = new AtomicLong();
  private final AtomicLong finalsAppended = new AtomicLong();

  public ResponseDispatcher(
      String sessionId, Consumer<ServerMessage> client, TranscriptAccumulator accumulator) {
    this.sessionId = sessionId;
    this.client = client;
    this.accumulator = accumulator;
  }

  public void dispatch(RecognitionResponse response) {
    switch (response.speechEvent()) {
      case ACTIVITY_BEGIN -> {
        LOGGER.debug("Speech activity began");
        client.accept(ServerMessage.VadEvent.speechStart());
      }
      case ACTIVITY_END -> {
        LOGGER.debug("Speech activity ended");
        client.accept(ServerMessage.VadEvent.speechEnd());
      }
      case NONE -> {
        // transcript-only response
      }
    }

    for (Result result : response.results()) {
      if (result.alternatives().isEmpty()) {
        continue;
      }
      Alternative top = result.alternatives().get(0);

      LOGGER.debug(
          "Transcript: final={}, confidence={}, chars={}",
          result.isFinal(),
          top.confidence(),
          top.transcript().length());

      client.accept(
          new ServerMessage.Transcript(top.transcript(), result.isFinal(), top.confidence()));
      transcriptsSent.incrementAndGet();

      if (result.isFinal()
          && accumulator.append(
              sessionId, top.transcript(), top.confidence(), result.languageCode())) {
        finalsAppended.incrementAndGet();
      }
    }
  }

  public long transcriptsSent() {
    return transcriptsSent.get();
  }

  public long finalsAppended() {
    return finalsAppended.get();
  }
}
