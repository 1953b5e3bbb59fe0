package com.flamingo.ai.kbsearch.service.embedding;

import java.util.Locale;

/** Where a model's vectors come from. */
public enum EmbeddingProvider {
  /** ONNX model run inside the JVM. */
  IN_PROCESS,
  OLLAMA,
  OPENAI;

  /** Parses config values such as {@code in-process} or {@code ollama}. */
  public static EmbeddingProvider fromConfig(String value) {
    return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}
