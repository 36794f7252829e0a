package com.scholary.relay.config;

import java.util.concurrent.Executor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the recognition worker pool.
 *
 * <p>Each live relay holds one worker for the duration of its streaming call, so the pool size is
 * the number of concurrent transcription streams. With a zero queue size a full pool rejects new
 * relays immediately instead of making them wait.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class AsyncConfig {

  @Bean(name = "relayExecutor")
  public Executor relayExecutor(RelayProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueSize());
    executor.setThreadNamePrefix("relay-worker-");
    executor.initialize();
    return executor;
  }
}
