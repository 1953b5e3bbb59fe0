package com.flamingo.ai.kbsearch.api.dto.request;

import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for submitting an ingestion job. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionJobRequest {

  /** INCREMENTAL when absent. */
  private IngestionMode mode;

  private String model;

  /** Directory or file, absolute or relative to the corpus root. Blank means the whole corpus. */
  private String target;
}
