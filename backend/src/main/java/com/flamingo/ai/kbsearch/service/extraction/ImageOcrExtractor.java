package com.flamingo.ai.kbsearch.service.extraction;

import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ImageOcrExtractor implements FormatExtractor {

  private final OcrEngine ocrEngine;

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.OCR;
  }

  @Override
  public ExtractionResult extract(Path path, DocumentFormat format) {
    return ExtractionResult.singlePage(ocrEngine.recognize(path), ExtractionMethod.OCR, true);
  }
}
