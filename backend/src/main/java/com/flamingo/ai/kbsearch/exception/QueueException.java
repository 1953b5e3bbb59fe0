package com.flamingo.ai.kbsearch.exception;

/** Exception thrown by the job queue. */
public class QueueException extends RuntimeException {

  /** What went wrong with the queue. */
  public enum Kind {
    UNAVAILABLE,
    SERIALIZATION,
    REDELIVERY_EXHAUSTED
  }

  private final Kind kind;
  private final String jobId;

  public QueueException(Kind kind, String jobId, String message) {
    super(message);
    this.kind = kind;
    this.jobId = jobId;
  }

  public QueueException(Kind kind, String jobId, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.jobId = jobId;
  }

  public Kind getKind() {
    return kind;
  }

  public String getJobId() {
    return jobId;
  }
}
