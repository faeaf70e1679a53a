package com.flamingo.ai.climatechat.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for pipeline stages that run against external services. */
@Configuration
public class AsyncConfig {

  /**
   * Runs outbound stage calls so the controller can bound them by the request deadline, and runs
   * the topic gate alongside first-pass retrieval.
   */
  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("pipeline-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }
}
