package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/**
 * Office Open XML and OpenDocument files parsed natively by Apache Tika. Near-empty output is
 * retried through the external renderer.
 */
@Component
@Slf4j
public class OfficeDocumentExtractor implements FormatExtractor {

  private final Tika tika;
  private final OcrFallbackPolicy ocrFallbackPolicy;
  private final DocumentRenderer renderer;

  public OfficeDocumentExtractor(OcrFallbackPolicy ocrFallbackPolicy, DocumentRenderer renderer) {
    this.ocrFallbackPolicy = ocrFallbackPolicy;
    this.renderer = renderer;
    this.tika = new Tika();
    this.tika.setMaxStringLength(-1);
  }

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.OFFICE;
  }

  @Override
  public ExtractionResult extract(Path path, DocumentFormat format) {
    String text;
    try {
      text = tika.parseToString(path.toFile());
    } catch (EncryptedDocumentException e) {
      throw new ExtractionException(
          ExtractionErrorKind.PASSWORD_PROTECTED, "Document is encrypted: " + path.getFileName(), e);
    } catch (TikaException | IOException e) {
      throw new ExtractionException(ExtractionErrorKind.CORRUPT_FILE, e.getMessage(), e);
    }

    if (!ocrFallbackPolicy.isNearEmpty(text, 1)) {
      return ExtractionResult.singlePage(text, ExtractionMethod.OFFICE, false);
    }

    log.info("[EXTRACT] Near-empty Tika output for {}, trying renderer", path.getFileName());
    try {
      return ExtractionResult.singlePage(
          renderer.renderToText(path), ExtractionMethod.OFFICE, false);
    } catch (ExtractionException e) {
      if (text.isBlank()) {
        throw e;
      }
      log.warn("[EXTRACT] Renderer fallback failed for {}: {}", path, e.getDetail());
      return ExtractionResult.singlePage(text, ExtractionMethod.OFFICE, false);
    }
  }
}
