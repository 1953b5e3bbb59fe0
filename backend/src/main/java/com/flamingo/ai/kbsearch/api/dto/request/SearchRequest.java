package com.flamingo.ai.kbsearch.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a hybrid search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Structured filters by canonical key or Italian alias. */
  private Map<String, String> filters;

  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 100, message = "topK must not exceed 100")
  private Integer topK;

  private Boolean deduplicate;
  private Boolean smartFilter;

  /** Embedding model; the default model when absent. */
  private String model;
}
