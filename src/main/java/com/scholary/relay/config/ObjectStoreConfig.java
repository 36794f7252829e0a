package com.scholary.relay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.relay.objectstore.ObjectStoreClient;
import com.scholary.relay.objectstore.ObjectStoreProperties;
import com.scholary.relay.objectstore.S3ObjectStoreClient;
import com.scholary.relay.transcript.TranscriptArchiver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for transcript archiving to object storage.
 *
 * <p>Only active with {@code relay.archive.enabled=true}; the object store properties are not
 * bound otherwise.
 */
@Configuration
@ConditionalOnProperty(prefix = "relay.archive", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public TranscriptArchiver transcriptArchiver(
      ObjectMapper objectMapper,
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties) {
    return new TranscriptArchiver(objectMapper, objectStoreClient, properties.bucket());
  }
}
