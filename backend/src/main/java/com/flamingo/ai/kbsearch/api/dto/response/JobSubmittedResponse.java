package com.flamingo.ai.kbsearch.api.dto.response;

import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an accepted ingestion job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmittedResponse {

  private String jobId;
  private IngestionMode mode;
  private String model;
  private String target;

  public static JobSubmittedResponse fromJob(IngestionJob job) {
    return JobSubmittedResponse.builder()
        .jobId(job.jobId())
        .mode(job.mode())
        .model(job.model())
        .target(job.target())
        .build();
  }
}
