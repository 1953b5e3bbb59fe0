package com.flamingo.ai.kbsearch.api.rest;

import com.flamingo.ai.kbsearch.api.dto.request.IngestionJobRequest;
import com.flamingo.ai.kbsearch.api.dto.response.JobSubmittedResponse;
import com.flamingo.ai.kbsearch.service.ingestion.IngestionService;
import com.flamingo.ai.kbsearch.service.ingestion.ProgressService;
import com.flamingo.ai.kbsearch.service.ingestion.ProgressSnapshot;
import com.flamingo.ai.kbsearch.service.queue.DeadLetter;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import com.flamingo.ai.kbsearch.service.queue.QueueStats;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for ingestion jobs, their progress and control. */
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

  private final IngestionService ingestionService;
  private final ProgressService progressService;

  /** Enqueues an ingestion job. */
  @PostMapping("/jobs")
  public ResponseEntity<JobSubmittedResponse> submit(
      @RequestBody(required = false) IngestionJobRequest request) {
    IngestionJobRequest body = request != null ? request : new IngestionJobRequest();
    IngestionJob job =
        ingestionService.submit(body.getMode(), body.getModel(), body.getTarget());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobSubmittedResponse.fromJob(job));
  }

  /** Progress of the current or most recent run. */
  @GetMapping("/progress")
  public ResponseEntity<ProgressSnapshot> progress() {
    return progressService
        .latestSnapshot()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping("/runs/{jobId}")
  public ResponseEntity<ProgressSnapshot> run(@PathVariable String jobId) {
    return ResponseEntity.ok(progressService.snapshot(jobId));
  }

  @PostMapping("/runs/{jobId}/pause")
  public ResponseEntity<ProgressSnapshot> pause(@PathVariable String jobId) {
    ingestionService.pause(jobId);
    return ResponseEntity.accepted().body(progressService.snapshot(jobId));
  }

  @PostMapping("/runs/{jobId}/resume")
  public ResponseEntity<ProgressSnapshot> resume(@PathVariable String jobId) {
    ingestionService.resume(jobId);
    return ResponseEntity.accepted().body(progressService.snapshot(jobId));
  }

  @PostMapping("/runs/{jobId}/cancel")
  public ResponseEntity<ProgressSnapshot> cancel(@PathVariable String jobId) {
    ingestionService.cancel(jobId);
    return ResponseEntity.accepted().body(progressService.snapshot(jobId));
  }

  /** Most recent failures across runs. */
  @GetMapping("/failures")
  public ResponseEntity<List<ProgressSnapshot.FailureView>> failures(
      @RequestParam(value = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(progressService.recentFailures(limit));
  }

  @GetMapping("/queue")
  public ResponseEntity<QueueStats> queue() {
    return ResponseEntity.ok(ingestionService.queueStats());
  }

  @GetMapping("/queue/dead-letters")
  public ResponseEntity<List<DeadLetter>> deadLetters(
      @RequestParam(value = "limit", defaultValue = "50") int limit) {
    return ResponseEntity.ok(ingestionService.deadLetters(limit));
  }
}
