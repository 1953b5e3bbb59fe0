package com.flamingo.ai.kbsearch.exception;

/** Exception thrown when an ingestion run is not found. */
public class IngestionRunNotFoundException extends RuntimeException {

  private final String jobId;

  public IngestionRunNotFoundException(String jobId) {
    super("Ingestion run not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
