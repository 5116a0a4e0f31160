package com.flamingo.ai.smartnotes.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for threads running time-limited collaborator calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "collaboratorExecutor")
  public ThreadPoolTaskExecutor collaboratorExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("collab-");
    executor.initialize();
    return executor;
  }
}
