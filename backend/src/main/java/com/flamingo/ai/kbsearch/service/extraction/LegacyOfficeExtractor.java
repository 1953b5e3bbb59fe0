package com.flamingo.ai.kbsearch.service.extraction;

import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Legacy binary office formats, always converted by the external renderer. */
@Component
@RequiredArgsConstructor
public class LegacyOfficeExtractor implements FormatExtractor {

  private final DocumentRenderer renderer;

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.RENDERER;
  }

  @Override
  public ExtractionResult extract(Path path, DocumentFormat format) {
    return ExtractionResult.singlePage(
        renderer.renderToText(path), ExtractionMethod.RENDERER, false);
  }
}
