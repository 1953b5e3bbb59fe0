package com.flamingo.ai.kbsearch.exception;

/** Exception thrown when text cannot be extracted from a document. */
public class ExtractionException extends RuntimeException {

  private final ExtractionErrorKind kind;
  private final String detail;

  public ExtractionException(ExtractionErrorKind kind, String detail) {
    super(kind + ": " + detail);
    this.kind = kind;
    this.detail = detail;
  }

  public ExtractionException(ExtractionErrorKind kind, String detail, Throwable cause) {
    super(kind + ": " + detail, cause);
    this.kind = kind;
    this.detail = detail;
  }

  public ExtractionErrorKind getKind() {
    return kind;
  }

  /** Human-readable detail stored alongside the kind. */
  public String getDetail() {
    return detail;
  }
}
