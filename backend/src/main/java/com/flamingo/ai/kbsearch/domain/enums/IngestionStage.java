package com.flamingo.ai.kbsearch.domain.enums;

/** Lifecycle stage of an ingestion run. */
public enum IngestionStage {
  QUEUED,
  SCANNING,
  PROCESSING,
  PAUSED,
  CANCELLED,
  DONE,
  FAILED;

  public boolean isFinished() {
    return this == CANCELLED || this == DONE || this == FAILED;
  }
}
