package com.flamingo.ai.kbsearch.service.queue;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.QueueException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-process {@link JobQueue} for tests and local runs. Jobs do not survive a restart.
 */
@Slf4j
public class InMemoryJobQueue implements JobQueue {

  private record Lease(IngestionJob job, Instant deadline) {}

  private final LinkedBlockingDeque<IngestionJob> pending = new LinkedBlockingDeque<>();
  private final Map<String, Lease> leases = new ConcurrentHashMap<>();
  private final Deque<DeadLetter> deadLetters = new ConcurrentLinkedDeque<>();
  private final IngestionConfig.Queue config;
  private final Clock clock;

  public InMemoryJobQueue(IngestionConfig.Queue config) {
    this(config, Clock.systemUTC());
  }

  public InMemoryJobQueue(IngestionConfig.Queue config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  @Override
  public void enqueue(IngestionJob job) {
    pending.addFirst(job);
    log.info("[QUEUE] Enqueued job {} (attempt {})", job.jobId(), job.attempt());
  }

  @Override
  public Optional<IngestionJob> dequeue(Duration blockTimeout) {
    try {
      IngestionJob job = pending.pollLast(blockTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (job == null) {
        return Optional.empty();
      }
      leases.put(
          job.jobId(), new Lease(job, Instant.now(clock).plus(config.getVisibilityTimeout())));
      return Optional.of(job);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  @Override
  public boolean extendLease(String jobId) {
    Lease extended =
        leases.computeIfPresent(
            jobId,
            (id, lease) ->
                new Lease(lease.job(), Instant.now(clock).plus(config.getVisibilityTimeout())));
    return extended != null;
  }

  @Override
  public void ack(String jobId) {
    leases.remove(jobId);
  }

  @Override
  public void requeue(String jobId, String reason) {
    Lease lease = leases.remove(jobId);
    if (lease == null) {
      log.warn("[QUEUE] Cannot requeue {}: not leased", jobId);
      return;
    }
    redeliver(lease.job(), reason);
  }

  @Override
  public void deadLetter(String jobId, String reason) {
    Lease lease = leases.remove(jobId);
    deadLetters.addFirst(
        new DeadLetter(lease == null ? null : lease.job(), reason, Instant.now(clock)));
    log.warn("[QUEUE] Dead-lettered job {}: {}", jobId, reason);
  }

  @Override
  public int reclaimExpired() {
    Instant now = Instant.now(clock);
    int reclaimed = 0;
    Iterator<Map.Entry<String, Lease>> it = leases.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, Lease> entry = it.next();
      if (entry.getValue().deadline().isAfter(now)) {
        continue;
      }
      it.remove();
      reclaimed++;
      try {
        redeliver(entry.getValue().job(), "visibility timeout expired");
      } catch (QueueException e) {
        log.warn("[QUEUE] {}", e.getMessage());
      }
    }
    return reclaimed;
  }

  @Override
  public List<DeadLetter> deadLetters(int limit) {
    List<DeadLetter> result = new ArrayList<>();
    for (DeadLetter letter : deadLetters) {
      if (result.size() >= limit) {
        break;
      }
      result.add(letter);
    }
    return result;
  }

  @Override
  public QueueStats stats() {
    return new QueueStats(pending.size(), leases.size(), deadLetters.size());
  }

  private void redeliver(IngestionJob job, String reason) {
    IngestionJob next = job.nextAttempt();
    if (next.attempt() >= config.getMaxDeliveries()) {
      deadLetters.addFirst(new DeadLetter(next, reason, Instant.now(clock)));
      throw new QueueException(
          QueueException.Kind.REDELIVERY_EXHAUSTED,
          job.jobId(),
          "Job " + job.jobId() + " dead-lettered after " + next.attempt() + " deliveries: "
              + reason);
    }
    pending.addFirst(next);
    log.info("[QUEUE] Requeued job {} (attempt {}): {}", job.jobId(), next.attempt(), reason);
  }
}
