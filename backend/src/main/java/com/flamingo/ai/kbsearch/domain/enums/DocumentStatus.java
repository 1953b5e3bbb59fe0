package com.flamingo.ai.kbsearch.domain.enums;

/** Per-document ingestion state. Transitions are owned by the ingestion orchestrator. */
public enum DocumentStatus {
  /** Seen during a scan, nothing processed yet. */
  DISCOVERED,

  /** Text extraction in progress. */
  EXTRACTING,

  /** Text extracted and fingerprinted. */
  EXTRACTED,

  /** Chunks are being embedded and written to the indexes. */
  EMBEDDING,

  /** Vector and lexical entries acknowledged for the current content and model. */
  INDEXED,

  /** The last attempt failed; the document is retried on the next run. */
  FAILED,

  /** Consecutive failures exceeded the threshold; skipped until the file changes. */
  QUARANTINED;

  public boolean isTerminalFailure() {
    return this == QUARANTINED;
  }
}
