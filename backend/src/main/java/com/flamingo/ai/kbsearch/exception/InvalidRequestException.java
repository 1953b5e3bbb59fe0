package com.flamingo.ai.kbsearch.exception;

/** Exception thrown for malformed search filters, unknown models and similar caller errors. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }
}
