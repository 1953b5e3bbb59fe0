package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides when native text is too thin to trust. The threshold is {@code max(minTextChars,
 * minCharsPerPage * pages)} non-whitespace characters.
 */
@Component
@RequiredArgsConstructor
public class OcrFallbackPolicy {

  private final IngestionConfig ingestionConfig;

  public boolean isNearEmpty(String text, int pageCount) {
    return TextCleaner.countNonWhitespace(text) < threshold(pageCount);
  }

  public boolean isPageNearEmpty(String pageText) {
    return TextCleaner.countNonWhitespace(pageText)
        < ingestionConfig.getExtraction().getMinCharsPerPage();
  }

  int threshold(int pageCount) {
    IngestionConfig.Extraction config = ingestionConfig.getExtraction();
    return Math.max(config.getMinTextChars(), config.getMinCharsPerPage() * Math.max(1, pageCount));
  }
}
