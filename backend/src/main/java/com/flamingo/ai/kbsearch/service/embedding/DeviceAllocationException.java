package com.flamingo.ai.kbsearch.service.embedding;

/** A backend could not allocate device memory for a batch. */
public class DeviceAllocationException extends RuntimeException {

  public DeviceAllocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
