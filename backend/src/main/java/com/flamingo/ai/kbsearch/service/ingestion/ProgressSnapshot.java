package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.domain.entity.IngestionFailure;
import com.flamingo.ai.kbsearch.domain.entity.IngestionRun;
import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import java.time.LocalDateTime;
import java.util.List;

/** Read-only view of a run and its most recent failures. */
public record ProgressSnapshot(
    String jobId,
    String model,
    IngestionMode mode,
    String target,
    IngestionStage stage,
    int total,
    int done,
    int succeeded,
    int skipped,
    int failed,
    int quarantined,
    String currentPath,
    boolean pauseRequested,
    boolean cancelRequested,
    String error,
    LocalDateTime createdAt,
    LocalDateTime startedAt,
    LocalDateTime finishedAt,
    List<FailureView> recentFailures) {

  /** One failure log entry. */
  public record FailureView(
      String path, String errorKind, String message, boolean quarantined, LocalDateTime at) {

    static FailureView from(IngestionFailure failure) {
      return new FailureView(
          failure.getPath(),
          failure.getErrorKind(),
          failure.getMessage(),
          failure.isQuarantined(),
          failure.getOccurredAt());
    }
  }

  static ProgressSnapshot from(IngestionRun run, List<IngestionFailure> failures) {
    return new ProgressSnapshot(
        run.getJobId(),
        run.getModel(),
        run.getMode(),
        run.getTarget(),
        run.getStage(),
        run.getTotal(),
        run.getDone(),
        run.getSucceeded(),
        run.getSkipped(),
        run.getFailed(),
        run.getQuarantined(),
        run.getCurrentPath(),
        run.isPauseRequested(),
        run.isCancelRequested(),
        run.getError(),
        run.getCreatedAt(),
        run.getStartedAt(),
        run.getFinishedAt(),
        failures.stream().map(FailureView::from).toList());
  }
}
