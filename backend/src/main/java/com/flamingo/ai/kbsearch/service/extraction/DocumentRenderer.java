package com.flamingo.ai.kbsearch.service.extraction;

import java.nio.file.Path;

/** Converts a document to plain text with an external office suite. */
public interface DocumentRenderer {

  /**
   * Renders the file to plain text.
   *
   * @throws com.flamingo.ai.kbsearch.exception.ExtractionException with {@code RENDERER_MISSING},
   *     {@code RENDERER_TIMEOUT} or {@code CORRUPT_FILE}
   */
  String renderToText(Path source);
}
