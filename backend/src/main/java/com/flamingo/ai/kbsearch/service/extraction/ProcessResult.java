package com.flamingo.ai.kbsearch.service.extraction;

/** Outcome of an external process that exited within its time budget. */
public record ProcessResult(int exitCode, String stdout, String stderr) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}
