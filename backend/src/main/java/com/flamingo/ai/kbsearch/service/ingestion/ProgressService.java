package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.domain.entity.IngestionFailure;
import com.flamingo.ai.kbsearch.domain.entity.IngestionRun;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import com.flamingo.ai.kbsearch.domain.repository.IngestionFailureRepository;
import com.flamingo.ai.kbsearch.domain.repository.IngestionRunRepository;
import com.flamingo.ai.kbsearch.exception.IngestionRunNotFoundException;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.IntSupplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the {@code ingestion_runs} progress records and the bounded failure log.
 *
 * <p>Writes commit in their own transaction; reads are plain queries, so any node can report
 * progress for any run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressService {

  private static final int SNAPSHOT_FAILURES = 10;
  private static final Set<IngestionStage> ACTIVE_STAGES =
      EnumSet.of(IngestionStage.SCANNING, IngestionStage.PROCESSING, IngestionStage.PAUSED);

  private final IngestionRunRepository runRepository;
  private final IngestionFailureRepository failureRepository;
  private final RetryingTransactions transactions;
  private final IngestionConfig ingestionConfig;

  /** Records a freshly submitted job in the QUEUED stage. */
  public IngestionRun createRun(IngestionJob job) {
    return transactions.execute(
        "create run " + job.jobId(),
        () ->
            runRepository.save(
                IngestionRun.builder()
                    .jobId(job.jobId())
                    .model(job.model())
                    .mode(job.mode())
                    .target(job.target())
                    .stage(IngestionStage.QUEUED)
                    .build()));
  }

  /**
   * Moves a run to SCANNING with zeroed counters. A redelivered job starts over; control flags
   * are kept.
   *
   * <p>A run still in progress elsewhere is left untouched: one whose stage is active and whose
   * last update is younger than the queue's visibility timeout.
   *
   * @return false when another worker still holds the run
   */
  public boolean startRun(IngestionJob job) {
    boolean started =
        transactions.execute(
            "start run " + job.jobId(),
            () -> {
              if (!runRepository.existsById(job.jobId())) {
                runRepository.saveAndFlush(
                    IngestionRun.builder()
                        .jobId(job.jobId())
                        .model(job.model())
                        .mode(job.mode())
                        .target(job.target())
                        .build());
              }
              LocalDateTime now = LocalDateTime.now();
              return runRepository.start(
                      job.jobId(),
                      IngestionStage.SCANNING,
                      ACTIVE_STAGES,
                      now.minus(ingestionConfig.getQueue().getVisibilityTimeout()),
                      now)
                  == 1;
            });
    if (!started) {
      log.warn(
          "[INGEST] Run {} is still active elsewhere, not restarting attempt {}",
          job.jobId(),
          job.attempt());
    }
    return started;
  }

  /** Marks the run as alive without changing its progress. */
  public void heartbeat(String jobId) {
    transactions.run("heartbeat " + jobId, () -> runRepository.touch(jobId, LocalDateTime.now()));
  }

  public void setTotal(String jobId, int total) {
    transactions.run(
        "set total " + jobId,
        () ->
            runRepository.updateTotal(
                jobId, total, IngestionStage.PROCESSING, LocalDateTime.now()));
  }

  public void setStage(String jobId, IngestionStage stage) {
    transactions.run(
        "set stage " + jobId,
        () -> runRepository.updateStage(jobId, stage, LocalDateTime.now()));
  }

  public void documentStarted(String jobId, String path) {
    transactions.run(
        "update current path " + jobId,
        () -> runRepository.updateCurrentPath(jobId, path, LocalDateTime.now()));
  }

  public void documentFinished(String jobId, DocumentOutcome outcome) {
    transactions.run(
        "count outcome " + jobId,
        () ->
            runRepository.incrementCounters(
                jobId,
                outcome == DocumentOutcome.INDEXED ? 1 : 0,
                outcome == DocumentOutcome.SKIPPED ? 1 : 0,
                outcome == DocumentOutcome.FAILED ? 1 : 0,
                outcome == DocumentOutcome.QUARANTINED ? 1 : 0,
                LocalDateTime.now()));
  }

  public void finish(String jobId, IngestionStage stage, String error) {
    transactions.run(
        "finish run " + jobId,
        () -> runRepository.finish(jobId, stage, error, LocalDateTime.now()));
    log.info("[INGEST] Run {} finished with stage {}", jobId, stage);
  }

  /** Appends to the failure log and prunes it to the configured size. */
  public void recordFailure(
      String jobId,
      UUID documentId,
      String path,
      String errorKind,
      String message,
      boolean quarantined) {
    int keep = ingestionConfig.getOrchestrator().getFailureLogSize();
    transactions.run(
        "record failure " + jobId,
        () -> {
          failureRepository.save(
              IngestionFailure.builder()
                  .jobId(jobId)
                  .documentId(documentId)
                  .path(path)
                  .errorKind(errorKind)
                  .message(message)
                  .quarantined(quarantined)
                  .build());
          List<IngestionFailure> newest =
              failureRepository.findAllByOrderByIdDesc(PageRequest.of(keep - 1, 1));
          if (!newest.isEmpty()) {
            failureRepository.deleteOlderThan(newest.get(0).getId());
          }
        });
  }

  @Transactional(readOnly = true)
  public RunControl control(String jobId) {
    IngestionRun run = find(jobId);
    return new RunControl(run.isPauseRequested(), run.isCancelRequested());
  }

  public void requestPause(String jobId) {
    updateFlag(jobId, () -> runRepository.updatePauseRequested(jobId, true, LocalDateTime.now()));
  }

  public void requestResume(String jobId) {
    updateFlag(jobId, () -> runRepository.updatePauseRequested(jobId, false, LocalDateTime.now()));
  }

  public void requestCancel(String jobId) {
    updateFlag(jobId, () -> runRepository.requestCancel(jobId, LocalDateTime.now()));
  }

  private void updateFlag(String jobId, IntSupplier update) {
    int updated = transactions.execute("update flags " + jobId, update::getAsInt);
    if (updated == 0) {
      throw new IngestionRunNotFoundException(jobId);
    }
    log.info("[INGEST] Control flag updated for run {}", jobId);
  }

  @Transactional(readOnly = true)
  public ProgressSnapshot snapshot(String jobId) {
    IngestionRun run = find(jobId);
    return ProgressSnapshot.from(
        run, failureRepository.findByJobIdOrderByIdDesc(jobId, PageRequest.of(0, SNAPSHOT_FAILURES)));
  }

  @Transactional(readOnly = true)
  public Optional<ProgressSnapshot> latestSnapshot() {
    return runRepository
        .findFirstByOrderByCreatedAtDesc()
        .map(
            run ->
                ProgressSnapshot.from(
                    run,
                    failureRepository.findByJobIdOrderByIdDesc(
                        run.getJobId(), PageRequest.of(0, SNAPSHOT_FAILURES))));
  }

  @Transactional(readOnly = true)
  public List<ProgressSnapshot.FailureView> recentFailures(int limit) {
    int bounded = Math.max(1, Math.min(limit, ingestionConfig.getOrchestrator().getFailureLogSize()));
    return failureRepository.findAllByOrderByIdDesc(PageRequest.of(0, bounded)).stream()
        .map(ProgressSnapshot.FailureView::from)
        .toList();
  }

  private IngestionRun find(String jobId) {
    return runRepository
        .findById(jobId)
        .orElseThrow(() -> new IngestionRunNotFoundException(jobId));
  }
}
