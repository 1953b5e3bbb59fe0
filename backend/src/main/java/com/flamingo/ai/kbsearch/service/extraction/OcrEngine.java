package com.flamingo.ai.kbsearch.service.extraction;

import java.nio.file.Path;

/** Optical character recognition over a single raster image. */
public interface OcrEngine {

  /**
   * Recognizes the text in an image file.
   *
   * @throws com.flamingo.ai.kbsearch.exception.ExtractionException with {@code OCR_FAILED}
   */
  String recognize(Path image);
}
