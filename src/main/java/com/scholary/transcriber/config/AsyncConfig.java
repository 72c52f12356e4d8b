package com.scholary.transcriber.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background execution.
 *
 * <p>Two pools: {@code jobExecutor} runs whole jobs (bounded queue, so overload is rejected
 * instead of piling up), {@code chunkExecutor} runs individual recognition calls. The chunk pool
 * is shared by all jobs, so its size is the global cap on concurrent calls to the speech service.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public Executor jobExecutor(TranscriptionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobExecutorThreads());
    executor.setMaxPoolSize(properties.jobExecutorThreads());
    executor.setQueueCapacity(properties.jobExecutorQueueSize());
    executor.setThreadNamePrefix("transcription-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "chunkExecutor")
  public Executor chunkExecutor(TranscriptionProperties properties) {
    int inFlight = properties.orchestration().maxInFlightChunks();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(inFlight);
    executor.setMaxPoolSize(inFlight);
    executor.setThreadNamePrefix("transcription-chunk-");
    executor.initialize();
    return executor;
  }
}
