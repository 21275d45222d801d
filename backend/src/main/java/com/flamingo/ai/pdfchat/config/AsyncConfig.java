package com.flamingo.ai.pdfchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** Runs one ingest or query per task for the async pipeline entry points. */
  @Bean(name = "ragExecutor")
  public ThreadPoolTaskExecutor ragExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("rag-");
    executor.initialize();
    return executor;
  }

  /**
   * Runs individual backend calls so that a call exceeding its timeout can be cancelled without
   * blocking the requesting thread.
   */
  @Bean(name = "backendCallExecutor")
  public ThreadPoolTaskExecutor backendCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("backend-call-");
    executor.initialize();
    return executor;
  }
}
