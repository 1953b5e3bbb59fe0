package com.flamingo.ai.kbsearch.service.extraction;

/** Extraction strategy a {@link DocumentFormat} is routed to. */
public enum ExtractionMethod {
  /** Direct decode of a text file. */
  TEXT,

  /** PDFBox text layer, OCR on near-empty pages. */
  PDF,

  /** Apache Tika native parse, external renderer on near-empty output. */
  OFFICE,

  /** External renderer conversion of legacy binary office files. */
  RENDERER,

  /** OCR of a raster image. */
  OCR
}
