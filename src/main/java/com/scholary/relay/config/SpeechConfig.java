package com.scholary.relay.config;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.speech.v2.SpeechClient;
import com.google.cloud.speech.v2.SpeechSettings;
import com.scholary.relay.speech.GoogleSpeechBackend;
import com.scholary.relay.speech.SpeechProperties;
import com.scholary.relay.speech.SpeechRecognitionBackend;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Configuration for the speech recognition backend.
 *
 * <p>A single {@link SpeechClient} is created at startup and shared by every relay; it owns the
 * gRPC channel and is closed when the context shuts down. With {@code speech.enabled=false} no
 * client is created and another {@link SpeechRecognitionBackend} bean must be supplied.
 */
@Configuration
@EnableConfigurationProperties(SpeechProperties.class)
public class SpeechConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechConfig.class);

  private static final String CLOUD_PLATFORM_SCOPE =
      "https://www.googleapis.com/auth/cloud-platform";

  @Configuration
  @ConditionalOnProperty(prefix = "speech", name = "enabled", havingValue = "true",
      matchIfMissing = true)
  static class GoogleSpeechConfig {

    @Bean(destroyMethod = "close")
    public SpeechClient speechClient(SpeechProperties properties) throws IOException {
      SpeechSettings.Builder settings = SpeechSettings.newBuilder();
      if (properties.endpoint() != null) {
        settings.setEndpoint(properties.endpoint());
      }
      if (StringUtils.hasText(properties.credentialsPath())) {
        try (InputStream in = Files.newInputStream(Path.of(properties.credentialsPath()))) {
          GoogleCredentials credentials =
              GoogleCredentials.fromStream(in).createScoped(CLOUD_PLATFORM_SCOPE);
          settings.setCredentialsProvider(FixedCredentialsProvider.create(credentials));
        }
      }
      LOGGER.info(
          "Creating speech client: recognizer={}, endpoint={}",
          properties.recognizerPath(),
          properties.endpoint() == null ? "default" : properties.endpoint());
      return SpeechClient.create(settings.build());
    }

    @Bean
    public SpeechRecognitionBackend speechRecognitionBackend(
        SpeechClient speechClient, SpeechProperties properties) {
      return new GoogleSpeechBackend(speechClient, properties);
    }
  }
}
