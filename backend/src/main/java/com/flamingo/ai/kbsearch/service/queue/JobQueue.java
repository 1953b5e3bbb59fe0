package com.flamingo.ai.kbsearch.service.queue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * At-least-once queue of ingestion jobs.
 *
 * <p>A dequeued job is leased until its visibility deadline. Unless it is acknowledged, requeued
 * or dead-lettered before then, {@link #reclaimExpired()} returns it to the pending list. A job is
 * delivered at most {@code maxDeliveries} times before it is dead-lettered.
 */
public interface JobQueue {

  void enqueue(IngestionJob job);

  /** Waits up to {@code blockTimeout} for a job and leases it. */
  Optional<IngestionJob> dequeue(Duration blockTimeout);

  /**
   * Pushes the deadline of a leased job one visibility timeout past now.
   *
   * @return false when the job is no longer leased, for instance after it was reclaimed
   */
  boolean extendLease(String jobId);

  /** Completes a leased job. */
  void ack(String jobId);

  /**
   * Returns a leased job to the pending list with its attempt count incremented.
   *
   * @throws com.flamingo.ai.kbsearch.exception.QueueException with {@code REDELIVERY_EXHAUSTED}
   *     after dead-lettering the job when no delivery is left
   */
  void requeue(String jobId, String reason);

  /** Moves a leased job to the dead-letter list. */
  void deadLetter(String jobId, String reason);

  /**
   * Returns every lease past its deadline to the pending list.
   *
   * @return number of jobs reclaimed, dead-lettered ones included
   */
  int reclaimExpired();

  List<DeadLetter> deadLetters(int limit);

  QueueStats stats();
}
