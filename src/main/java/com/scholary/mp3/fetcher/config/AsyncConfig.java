package com.scholary.mp3.fetcher.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background task execution.
 *
 * <p>Three pools are set up, all owned by the application context and shut down with it:
 *
 * <ul>
 *   <li>{@code conversionExecutor}: one worker per running conversion job
 *   <li>{@code streamExecutor}: the polling loops that write progress to connected clients
 *   <li>{@code reclaimerScheduler}: one-shot timers that delete expired job directories
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "conversionExecutor")
  public ThreadPoolTaskExecutor conversionExecutor(ConverterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerQueueSize());
    executor.setThreadNamePrefix("conversion-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamExecutor")
  public ThreadPoolTaskExecutor streamExecutor(ConverterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.streamThreads());
    executor.setMaxPoolSize(properties.streamThreads());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("sse-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "reclaimerScheduler")
  public TaskScheduler reclaimerScheduler(ConverterProperties properties) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(properties.reclaimerThreads());
    scheduler.setThreadNamePrefix("reclaimer-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
