package com.flamingo.ai.kbsearch.service.ingestion;

/** How one document ended within a run. */
public enum DocumentOutcome {
  INDEXED,
  SKIPPED,
  FAILED,
  QUARANTINED
}
