package com.scholary.relay.relay;

import com.scholary.relay.config.RelayProperties;
import com.scholary.relay.protocol.ClientConnection;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.speech.RecognitionSettings;
import com.scholary.relay.speech.SpeechProperties;
import com.scholary.relay.speech.SpeechRecognitionBackend;
import com.scholary.relay.streaming.BridgeQueue;
import com.scholary.relay.transcript.TranscriptAccumulator;
import com.scholary.relay.transcript.TranscriptArchiver;
import com.scholary.relay.transcript.TranscriptRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** Assembles a {@link StreamingRelay} with its queue, generator, driver and dispatcher. */
@Component
public class RelayFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(RelayFactory.class);

  private final RelayProperties relayProperties;
  private final RecognitionSettings settings;
  private final SpeechRecognitionBackend backend;
  private final TranscriptAccumulator accumulator;
  private final TranscriptRepository transcripts;
  private final MessageCodec codec;
  private final RelayRegistry registry;
  private final ObjectProvider<TranscriptArchiver> archiver;

  public RelayFactory(
      RelayProperties relayProperties,
      SpeechProperties speechProperties,
      SpeechRecognitionBackend backend,
      TranscriptAccumulator accumulator,
      TranscriptRepository transcripts,
      MessageCodec codec,
      RelayRegistry registry,
      ObjectProvider<TranscriptArchiver> archiver) {
    this.relayProperties = relayProperties;
    this.settings = RecognitionSettings.from(speechProperties);
    this.backend = backend;
    this.accumulator = accumulator;
    this.transcripts = transcripts;
    this.codec = codec;
    this.registry = registry;
    this.archiver = archiver;
  }

  public StreamingRelay create(String sessionId, String principalId, ClientConnection connection) {
    BridgeQueue queue =
        new BridgeQueue(relayProperties.queueCapacity(), relayProperties.offerTimeout());
    return new StreamingRelay(
        UUID.randomUUID().toString(),
        sessionId,
        principalId,
        connection,
        queue,
        settings,
        relayProperties.idleTimeout(),
        backend,
        accumulator,
        transcripts,
        codec,
        this::onClosed);
  }

  private void onClosed(StreamingRelay relay) {
    registry.release(relay);
    archiver.ifAvailable(
        a -> {
          if (transcripts.findBySessionId(relay.sessionId()).map(a::archive).orElse(false)) {
            LOGGER.debug("Transcript archive written for relay {}", relay.relayId());
          }
        });
  }
}
