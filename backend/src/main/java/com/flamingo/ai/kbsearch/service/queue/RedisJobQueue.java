package com.flamingo.ai.kbsearch.service.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.QueueException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed {@link JobQueue}.
 *
 * <ul>
 *   <li>{@code <prefix>:pending}: list of job IDs, pushed left and popped right
 *   <li>{@code <prefix>:processing}: sorted set of leased job IDs scored by lease deadline
 *   <li>{@code <prefix>:payloads}: hash of job ID to job JSON
 *   <li>{@code <prefix>:dlq}: list of dead-letter JSON, expiring after {@code deadLetterTtl}
 * </ul>
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

  // ZADD XX on a member that is still leased; a reclaimed job is left alone
  private static final RedisScript<Long> EXTEND_LEASE =
      new DefaultRedisScript<>(
          "if redis.call('ZSCORE', KEYS[1], ARGV[2]) then "
              + "redis.call('ZADD', KEYS[1], 'XX', ARGV[1], ARGV[2]) return 1 end return 0",
          Long.class);

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final IngestionConfig.Queue config;
  private final Clock clock;

  private final String pendingKey;
  private final String processingKey;
  private final String payloadKey;
  private final String deadLetterKey;

  public RedisJobQueue(
      StringRedisTemplate redis, ObjectMapper objectMapper, IngestionConfig.Queue config) {
    this(redis, objectMapper, config, Clock.systemUTC());
  }

  RedisJobQueue(
      StringRedisTemplate redis,
      ObjectMapper objectMapper,
      IngestionConfig.Queue config,
      Clock clock) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.config = config;
    this.clock = clock;
    this.pendingKey = config.getKeyPrefix() + ":pending";
    this.processingKey = config.getKeyPrefix() + ":processing";
    this.payloadKey = config.getKeyPrefix() + ":payloads";
    this.deadLetterKey = config.getKeyPrefix() + ":dlq";
  }

  @Override
  public void enqueue(IngestionJob job) {
    String json = write(job, job.jobId());
    try {
      redis.opsForHash().put(payloadKey, job.jobId(), json);
      redis.opsForList().leftPush(pendingKey, job.jobId());
      log.info("[QUEUE] Enqueued job {} (attempt {})", job.jobId(), job.attempt());
    } catch (DataAccessException e) {
      throw unavailable(job.jobId(), e);
    }
  }

  @Override
  public Optional<IngestionJob> dequeue(Duration blockTimeout) {
    try {
      String jobId =
          redis.opsForList().rightPop(pendingKey, blockTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (jobId == null) {
        return Optional.empty();
      }
      redis.opsForZSet().add(processingKey, jobId, leaseDeadline());
      Optional<IngestionJob> job = readPayload(jobId);
      if (job.isEmpty()) {
        log.warn("[QUEUE] Job {} has no payload, dropping", jobId);
        redis.opsForZSet().remove(processingKey, jobId);
      }
      return job;
    } catch (DataAccessException e) {
      throw unavailable(null, e);
    }
  }

  @Override
  public boolean extendLease(String jobId) {
    try {
      Long extended =
          redis.execute(
              EXTEND_LEASE,
              List.of(processingKey),
              Long.toString((long) leaseDeadline()),
              jobId);
      return extended != null && extended == 1L;
    } catch (DataAccessException e) {
      throw unavailable(jobId, e);
    }
  }

  @Override
  public void ack(String jobId) {
    try {
      redis.opsForZSet().remove(processingKey, jobId);
      redis.opsForHash().delete(payloadKey, jobId);
    } catch (DataAccessException e) {
      throw unavailable(jobId, e);
    }
  }

  @Override
  public void requeue(String jobId, String reason) {
    try {
      redis.opsForZSet().remove(processingKey, jobId);
      redeliver(jobId, reason);
    } catch (DataAccessException e) {
      throw unavailable(jobId, e);
    }
  }

  @Override
  public void deadLetter(String jobId, String reason) {
    try {
      redis.opsForZSet().remove(processingKey, jobId);
      IngestionJob job = readPayload(jobId).orElse(null);
      pushDeadLetter(jobId, job, reason);
    } catch (DataAccessException e) {
      throw unavailable(jobId, e);
    }
  }

  @Override
  public int reclaimExpired() {
    try {
      Set<String> expired =
          redis.opsForZSet().rangeByScore(processingKey, 0, clock.millis());
      if (expired == null || expired.isEmpty()) {
        return 0;
      }
      int reclaimed = 0;
      for (String jobId : expired) {
        // Only the caller that removes the lease reclaims it
        Long removed = redis.opsForZSet().remove(processingKey, jobId);
        if (removed == null || removed == 0) {
          continue;
        }
        reclaimed++;
        try {
          redeliver(jobId, "visibility timeout expired");
        } catch (QueueException e) {
          log.warn("[QUEUE] {}", e.getMessage());
        }
      }
      return reclaimed;
    } catch (DataAccessException e) {
      throw unavailable(null, e);
    }
  }

  @Override
  public List<DeadLetter> deadLetters(int limit) {
    try {
      List<String> raw = redis.opsForList().range(deadLetterKey, 0, Math.max(0, limit - 1));
      List<DeadLetter> letters = new ArrayList<>();
      if (raw == null) {
        return letters;
      }
      for (String json : raw) {
        try {
          letters.add(objectMapper.readValue(json, DeadLetter.class));
        } catch (JsonProcessingException e) {
          log.warn("[QUEUE] Unreadable dead letter skipped: {}", e.getOriginalMessage());
        }
      }
      return letters;
    } catch (DataAccessException e) {
      throw unavailable(null, e);
    }
  }

  @Override
  public QueueStats stats() {
    try {
      Long pending = redis.opsForList().size(pendingKey);
      Long inFlight = redis.opsForZSet().zCard(processingKey);
      Long dead = redis.opsForList().size(deadLetterKey);
      return new QueueStats(orZero(pending), orZero(inFlight), orZero(dead));
    } catch (DataAccessException e) {
      throw unavailable(null, e);
    }
  }

  private void redeliver(String jobId, String reason) {
    Optional<IngestionJob> current = readPayload(jobId);
    if (current.isEmpty()) {
      log.warn("[QUEUE] Cannot requeue {}: payload missing", jobId);
      return;
    }
    IngestionJob next = current.get().nextAttempt();
    if (next.attempt() >= config.getMaxDeliveries()) {
      pushDeadLetter(jobId, next, reason);
      throw new QueueException(
          QueueException.Kind.REDELIVERY_EXHAUSTED,
          jobId,
          "Job " + jobId + " dead-lettered after " + next.attempt() + " deliveries: " + reason);
    }
    redis.opsForHash().put(payloadKey, jobId, write(next, jobId));
    redis.opsForList().leftPush(pendingKey, jobId);
    log.info("[QUEUE] Requeued job {} (attempt {}): {}", jobId, next.attempt(), reason);
  }

  private void pushDeadLetter(String jobId, IngestionJob job, String reason) {
    DeadLetter letter = new DeadLetter(job, reason, Instant.now(clock));
    redis.opsForList().leftPush(deadLetterKey, write(letter, jobId));
    redis.expire(deadLetterKey, config.getDeadLetterTtl());
    redis.opsForHash().delete(payloadKey, jobId);
    log.warn("[QUEUE] Dead-lettered job {}: {}", jobId, reason);
  }

  private Optional<IngestionJob> readPayload(String jobId) {
    Object json = redis.opsForHash().get(payloadKey, jobId);
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json.toString(), IngestionJob.class));
    } catch (JsonProcessingException e) {
      throw new QueueException(
          QueueException.Kind.SERIALIZATION, jobId, "Unreadable payload for job " + jobId, e);
    }
  }

  private String write(Object value, String jobId) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new QueueException(
          QueueException.Kind.SERIALIZATION, jobId, "Cannot serialize job " + jobId, e);
    }
  }

  private double leaseDeadline() {
    return clock.millis() + config.getVisibilityTimeout().toMillis();
  }

  private static long orZero(Long value) {
    return value == null ? 0 : value;
  }

  private static QueueException unavailable(String jobId, DataAccessException e) {
    return new QueueException(
        QueueException.Kind.UNAVAILABLE, jobId, "Redis unavailable: " + e.getMessage(), e);
  }
}
