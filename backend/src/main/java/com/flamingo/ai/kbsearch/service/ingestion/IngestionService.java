package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import com.flamingo.ai.kbsearch.exception.InvalidRequestException;
import com.flamingo.ai.kbsearch.exception.QueueException;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.queue.DeadLetter;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import com.flamingo.ai.kbsearch.service.queue.QueueStats;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Entry point for submitting and steering ingestion jobs. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final JobQueue jobQueue;
  private final ProgressService progressService;
  private final EmbeddingModelRegistry modelRegistry;
  private final CorpusScanner corpusScanner;

  /**
   * Validates and enqueues a job. The run record exists before the job becomes visible to workers.
   *
   * @throws InvalidRequestException when the model is unknown or the target does not exist
   */
  public IngestionJob submit(IngestionMode mode, String model, String target) {
    String resolvedModel;
    try {
      resolvedModel = modelRegistry.resolve(model);
    } catch (EmbeddingException e) {
      throw new InvalidRequestException(e.getMessage());
    }
    Path resolvedTarget = corpusScanner.resolveTarget(target);
    if (!Files.exists(resolvedTarget)) {
      throw new InvalidRequestException("Target does not exist: " + resolvedTarget);
    }
    IngestionJob job =
        IngestionJob.create(
            mode == null ? IngestionMode.INCREMENTAL : mode,
            resolvedModel,
            resolvedTarget.toString());
    progressService.createRun(job);
    try {
      jobQueue.enqueue(job);
    } catch (QueueException e) {
      progressService.finish(job.jobId(), IngestionStage.FAILED, "Enqueue failed: " + e.getMessage());
      throw e;
    }
    log.info(
        "[INGEST] Submitted job {}: mode={}, model={}, target={}",
        job.jobId(),
        job.mode(),
        job.model(),
        job.target());
    return job;
  }

  public void pause(String jobId) {
    progressService.requestPause(jobId);
  }

  public void resume(String jobId) {
    progressService.requestResume(jobId);
  }

  public void cancel(String jobId) {
    progressService.requestCancel(jobId);
  }

  public QueueStats queueStats() {
    return jobQueue.stats();
  }

  public List<DeadLetter> deadLetters(int limit) {
    return jobQueue.deadLetters(limit);
  }
}
