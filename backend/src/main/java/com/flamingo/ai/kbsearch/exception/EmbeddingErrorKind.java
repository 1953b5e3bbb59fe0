package com.flamingo.ai.kbsearch.exception;

/** Classification of embedding failures. */
public enum EmbeddingErrorKind {
  DIMENSION_MISMATCH,
  DEVICE_EXHAUSTED,
  UNKNOWN_MODEL,
  BACKEND_FAILURE
}
