package com.flamingo.ai.kbsearch.service.ingestion;

/** Control flags of a run, read between documents. */
public record RunControl(boolean pauseRequested, boolean cancelRequested) {}
