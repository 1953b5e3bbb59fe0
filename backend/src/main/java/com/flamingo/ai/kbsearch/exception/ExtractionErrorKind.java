package com.flamingo.ai.kbsearch.exception;

/** Stable classification of text extraction failures, persisted with the document. */
public enum ExtractionErrorKind {
  /** The extension maps to no known document format. */
  UNSUPPORTED_FORMAT,

  /** The external renderer binary could not be started. */
  RENDERER_MISSING,

  /** The external renderer exceeded its time budget and was killed. */
  RENDERER_TIMEOUT,

  /** The file could not be read or parsed. */
  CORRUPT_FILE,

  /** The file is encrypted. */
  PASSWORD_PROTECTED,

  /** OCR could not produce text. */
  OCR_FAILED,

  /** Every strategy, OCR included, yielded no text. */
  EMPTY_CONTENT
}
