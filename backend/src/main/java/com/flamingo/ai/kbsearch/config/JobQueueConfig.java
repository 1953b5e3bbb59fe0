package com.flamingo.ai.kbsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.kbsearch.service.queue.InMemoryJobQueue;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import com.flamingo.ai.kbsearch.service.queue.RedisJobQueue;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Selects the job queue implementation from {@code ingestion.queue.type}. */
@Configuration
public class JobQueueConfig {

  @Bean
  @ConditionalOnProperty(name = "ingestion.queue.type", havingValue = "redis", matchIfMissing = true)
  public JobQueue redisJobQueue(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, IngestionConfig config) {
    return new RedisJobQueue(redisTemplate, objectMapper, config.getQueue());
  }

  @Bean
  @ConditionalOnProperty(name = "ingestion.queue.type", havingValue = "memory")
  public JobQueue inMemoryJobQueue(IngestionConfig config) {
    return new InMemoryJobQueue(config.getQueue());
  }
}
