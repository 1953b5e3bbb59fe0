package com.flamingo.ai.kbsearch.service.embedding;

public enum ExecutionPath {
  ACCELERATED,
  CPU
}
