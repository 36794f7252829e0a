package com.scholary.relay.speech;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Google Cloud Speech-to-Text v2 backend.
 *
 * <p>{@code location} selects both the recognizer path and the regional endpoint; {@code global}
 * uses the default endpoint. {@code credentialsPath} is optional: when blank the client uses
 * application default credentials.
 */
@ConfigurationProperties(prefix = "speech")
@Validated
public record SpeechProperties(
    boolean enabled,
    @NotBlank String projectId,
    @NotBlank String location,
    @NotBlank String recognizer,
    @NotBlank String model,
    @NotEmpty @Size(max = 3) List<String> languageCodes,
    @Positive int sampleRateHertz,
    @Positive int audioChannelCount,
    boolean interimResults,
    boolean voiceActivityEvents,
    String credentialsPath,
    @Positive int completionTimeoutSeconds) {

  /** Full recognizer resource name, e.g. {@code projects/p/locations/global/recognizers/_}. */
  public String recognizerPath() {
    return String.format(
        "projects/%s/locations/%s/recognizers/%s", projectId, location, recognizer);
  }

  /** Regional API endpoint, or null for the library default. */
  public String endpoint() {
    if ("global".equals(location)) {
      return null;
    }
    return location + "-speech.googleapis.com:443";
  }
}
