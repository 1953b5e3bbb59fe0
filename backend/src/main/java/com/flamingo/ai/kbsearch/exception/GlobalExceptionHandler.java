package com.flamingo.ai.kbsearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {
    String errorId = record("document_not_found");
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());
    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(IngestionRunNotFoundException.class)
  public ResponseEntity<ApiError> handleRunNotFound(
      IngestionRunNotFoundException ex, HttpServletRequest request) {
    String errorId = record("ingestion_run_not_found");
    log.warn("Ingestion run not found [{}]: {}", errorId, ex.getJobId());
    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.INGESTION_RUN_NOT_FOUND,
        "Ingestion run not found",
        request);
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {
    String errorId = record("invalid_request");
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_REQUEST, ex.getMessage(), request);
  }

  @ExceptionHandler(QueueException.class)
  public ResponseEntity<ApiError> handleQueue(QueueException ex, HttpServletRequest request) {
    String errorId = record("queue_error");
    log.error("Queue error [{}] kind={}: {}", errorId, ex.getKind(), ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.QUEUE_UNAVAILABLE,
        "The ingestion queue is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    String errorId = record("search_error");
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ApiError> handleEmbedding(
      EmbeddingException ex, HttpServletRequest request) {
    if (ex.getKind() == EmbeddingErrorKind.UNKNOWN_MODEL) {
      String errorId = record("unknown_model");
      log.warn("Unknown model [{}]: {}", errorId, ex.getModel());
      return respond(
          HttpStatus.BAD_REQUEST, errorId, ApiError.UNKNOWN_MODEL, ex.getMessage(), request);
    }
    String errorId = record("embedding_error");
    log.error("Embedding error [{}] kind={}: {}", errorId, ex.getKind(), ex.getMessage(), ex);
    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        "The embedding backend is temporarily unavailable. Please try again.",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = record("validation_error");
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_REQUEST, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    String errorId = record("internal_error");
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private String record(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return UUID.randomUUID().toString().substring(0, 8);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }
}
