package com.flamingo.ai.kbsearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for background ingestion work. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * Runs the queue-consuming worker loops. One thread per configured loop; jobs inside a loop are
   * processed sequentially.
   */
  @Bean(name = "ingestionWorkerExecutor")
  public ThreadPoolTaskExecutor ingestionWorkerExecutor(IngestionConfig ingestionConfig) {
    int loops = Math.max(1, ingestionConfig.getWorker().getConcurrency());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(loops);
    executor.setMaxPoolSize(loops);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("ingest-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
