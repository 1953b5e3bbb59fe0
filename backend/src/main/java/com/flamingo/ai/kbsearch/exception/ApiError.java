package com.flamingo.ai.kbsearch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String INGESTION_RUN_NOT_FOUND = "INGESTION_001";
  public static final String QUEUE_UNAVAILABLE = "INGESTION_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String UNKNOWN_MODEL = "EMBEDDING_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_002";
  public static final String INVALID_REQUEST = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
