package com.scholary.tts.handler.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two pools:
 *
 * <ul>
 *   <li>{@code synthesisExecutor}: exactly {@code tts.max-concurrent} workers over an unbounded
 *       FIFO queue. Admission control in the job manager is what bounds the queue.
 *   <li>{@code maintenanceExecutor}: a single thread for best-effort background chores such as
 *       cleaning up job records after their artifact is deleted.
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(TtsProperties.class)
public class AsyncConfig {

  @Bean(name = "synthesisExecutor")
  public ThreadPoolTaskExecutor synthesisExecutor(TtsProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrent());
    executor.setMaxPoolSize(properties.maxConcurrent());
    executor.setThreadNamePrefix("synthesis-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "maintenanceExecutor")
  public ThreadPoolTaskExecutor maintenanceExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("maintenance-");
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
