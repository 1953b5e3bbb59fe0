package com.flamingo.ai.kbsearch.service.queue;

import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import java.time.Instant;
import java.util.UUID;

/**
 * A unit of ingestion work on the queue.
 *
 * @param jobId stable identifier, also the ID of the run record
 * @param mode FULL or INCREMENTAL
 * @param model embedding model name
 * @param target directory or file, absolute or relative to the corpus root
 * @param attempt number of failed deliveries so far
 * @param enqueuedAt first enqueue time
 */
public record IngestionJob(
    String jobId,
    IngestionMode mode,
    String model,
    String target,
    int attempt,
    Instant enqueuedAt) {

  public static IngestionJob create(IngestionMode mode, String model, String target) {
    return new IngestionJob(UUID.randomUUID().toString(), mode, model, target, 0, Instant.now());
  }

  public IngestionJob nextAttempt() {
    return new IngestionJob(jobId, mode, model, target, attempt + 1, enqueuedAt);
  }
}
