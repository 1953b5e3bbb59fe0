package com.flamingo.ai.kbsearch.service.extraction;

import java.nio.file.Path;

/** One extraction strategy; {@link DocumentExtractor} routes each format to exactly one. */
public interface FormatExtractor {

  ExtractionMethod method();

  /**
   * Extracts text from the file.
   *
   * @throws com.flamingo.ai.kbsearch.exception.ExtractionException on any failure
   */
  ExtractionResult extract(Path path, DocumentFormat format);
}
