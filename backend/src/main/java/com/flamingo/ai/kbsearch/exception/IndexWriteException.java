package com.flamingo.ai.kbsearch.exception;

/**
 * Exception thrown when an index write is not acknowledged. Transient failures (backend
 * unavailable, throttling) may be retried; permanent ones (mapping or document rejection) may not.
 */
public class IndexWriteException extends RuntimeException {

  private final String indexName;
  private final boolean transientFailure;

  public IndexWriteException(
      String indexName, boolean transientFailure, String message, Throwable cause) {
    super(message, cause);
    this.indexName = indexName;
    this.transientFailure = transientFailure;
  }

  public static IndexWriteException transientFailure(
      String indexName, String message, Throwable cause) {
    return new IndexWriteException(indexName, true, message, cause);
  }

  public static IndexWriteException permanentFailure(String indexName, String message) {
    return new IndexWriteException(indexName, false, message, null);
  }

  public String getIndexName() {
    return indexName;
  }

  public boolean isTransient() {
    return transientFailure;
  }
}
