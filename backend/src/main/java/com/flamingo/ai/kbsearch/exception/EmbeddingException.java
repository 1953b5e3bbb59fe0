package com.flamingo.ai.kbsearch.exception;

/** Exception thrown when vectors cannot be produced or fail validation. */
public class EmbeddingException extends RuntimeException {

  private final EmbeddingErrorKind kind;
  private final String model;

  public EmbeddingException(EmbeddingErrorKind kind, String model, String message) {
    super(message);
    this.kind = kind;
    this.model = model;
  }

  public EmbeddingException(
      EmbeddingErrorKind kind, String model, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.model = model;
  }

  public EmbeddingErrorKind getKind() {
    return kind;
  }

  public String getModel() {
    return model;
  }
}
