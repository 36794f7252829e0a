package com.scholary.relay.speech;

import java.util.List;

/**
 * Recognition configuration sent once at the start of every streaming call.
 *
 * <p>Audio is always raw little-endian 16-bit PCM; the rest comes from {@link SpeechProperties}.
 */
public record RecognitionSettings(
    int sampleRateHertz,
    int audioChannelCount,
    List<String> languageCodes,
    String model,
    boolean interimResults,
    boolean voiceActivityEvents) {

  public RecognitionSettings {
    languageCodes = List.copyOf(languageCodes);
  }

  public static RecognitionSettings from(SpeechProperties properties) {
    return new RecognitionSettings(
        properties.sampleRateHertz(),
        properties.audioChannelCount(),
        properties.languageCodes(),
        properties.model(),
        properties.interimResults(),
        properties.voiceActivityEvents());
  }
}
