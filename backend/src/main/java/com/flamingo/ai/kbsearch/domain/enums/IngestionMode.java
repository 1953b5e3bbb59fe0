package com.flamingo.ai.kbsearch.domain.enums;

/** How an ingestion run treats documents processed by earlier runs. */
public enum IngestionMode {
  /** Reprocess every discovered document. */
  FULL,

  /** Skip documents whose bytes are unchanged and already indexed for the model. */
  INCREMENTAL
}
