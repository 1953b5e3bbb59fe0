package com.flamingo.ai.kbsearch.exception;

/** Exception thrown when a search backend call fails. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
