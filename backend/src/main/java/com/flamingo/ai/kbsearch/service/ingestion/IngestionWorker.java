package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.QueueException;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Consumes the job queue. Each loop leases one job at a time and runs it to completion; a job that
 * throws is handed back to the queue for redelivery.
 */
@Component
@Slf4j
public class IngestionWorker {

  private final JobQueue jobQueue;
  private final IngestionOrchestrator orchestrator;
  private final ThreadPoolTaskExecutor executor;
  private final IngestionConfig ingestionConfig;

  private volatile boolean running;

  public IngestionWorker(
      JobQueue jobQueue,
      IngestionOrchestrator orchestrator,
      @Qualifier("ingestionWorkerExecutor") ThreadPoolTaskExecutor executor,
      IngestionConfig ingestionConfig) {
    this.jobQueue = jobQueue;
    this.orchestrator = orchestrator;
    this.executor = executor;
    this.ingestionConfig = ingestionConfig;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    if (!ingestionConfig.getWorker().isEnabled()) {
      log.info("[WORKER] Ingestion worker disabled");
      return;
    }
    running = true;
    int loops = Math.max(1, ingestionConfig.getWorker().getConcurrency());
    for (int i = 0; i < loops; i++) {
      executor.execute(this::loop);
    }
    log.info("[WORKER] Started {} ingestion loop(s)", loops);
  }

  @PreDestroy
  public void stop() {
    running = false;
  }

  public boolean isRunning() {
    return running;
  }

  private void loop() {
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        pollOnce();
      } catch (QueueException e) {
        log.warn("[WORKER] Queue unavailable: {}", e.getMessage());
        backOff();
      } catch (RuntimeException e) {
        log.error("[WORKER] Unexpected error in worker loop", e);
        backOff();
      }
    }
  }

  /**
   * Reclaims expired leases, then waits for one job and runs it.
   *
   * @return true when a job was taken from the queue
   */
  @VisibleForTesting
  boolean pollOnce() {
    int reclaimed = jobQueue.reclaimExpired();
    if (reclaimed > 0) {
      log.info("[WORKER] Reclaimed {} expired lease(s)", reclaimed);
    }
    Optional<IngestionJob> next = jobQueue.dequeue(ingestionConfig.getQueue().getPollTimeout());
    if (next.isEmpty()) {
      return false;
    }
    IngestionJob job = next.get();
    log.info("[WORKER] Running job {} (attempt {})", job.jobId(), job.attempt() + 1);
    try {
      orchestrator.run(job);
      jobQueue.ack(job.jobId());
    } catch (RuntimeException e) {
      log.warn("[WORKER] Job {} failed, handing back to queue: {}", job.jobId(), e.getMessage());
      try {
        jobQueue.requeue(job.jobId(), e.getMessage());
      } catch (QueueException qe) {
        if (qe.getKind() != QueueException.Kind.REDELIVERY_EXHAUSTED) {
          throw qe;
        }
        log.error("[WORKER] Job {} dead-lettered: {}", job.jobId(), qe.getMessage());
      }
    }
    return true;
  }

  private void backOff() {
    try {
      Thread.sleep(ingestionConfig.getQueue().getPollTimeout().toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
