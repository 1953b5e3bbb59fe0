package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a file to the extraction strategy of its {@link DocumentFormat}.
 *
 * <p>Every failure surfaces as an {@link ExtractionException} carrying a stable {@link
 * ExtractionErrorKind}. A file whose every strategy yields no text fails with {@code
 * EMPTY_CONTENT}.
 */
@Service
@Slf4j
public class DocumentExtractor {

  private final Map<ExtractionMethod, FormatExtractor> extractors =
      new EnumMap<>(ExtractionMethod.class);

  public DocumentExtractor(List<FormatExtractor> formatExtractors) {
    for (FormatExtractor extractor : formatExtractors) {
      FormatExtractor previous = extractors.put(extractor.method(), extractor);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate extractor for " + extractor.method() + ": " + previous.getClass());
      }
    }
    for (ExtractionMethod method : ExtractionMethod.values()) {
      if (!extractors.containsKey(method)) {
        throw new IllegalStateException("No extractor registered for " + method);
      }
    }
  }

  @Timed(value = "extraction.duration", description = "Time to extract text from one document")
  public ExtractionResult extract(Path path) {
    DocumentFormat format = DocumentFormat.detect(path);
    if (!Files.isReadable(path)) {
      throw new ExtractionException(
          ExtractionErrorKind.CORRUPT_FILE, "File is not readable: " + path);
    }

    ExtractionResult result = extractors.get(format.getMethod()).extract(path, format);
    if (result.isBlank()) {
      throw new ExtractionException(
          ExtractionErrorKind.EMPTY_CONTENT, "No text extracted from " + path.getFileName());
    }
    log.debug(
        "[EXTRACT] {} via {} ({} pages, {} chars, ocr={})",
        path.getFileName(),
        result.method(),
        result.pageCount(),
        result.text().length(),
        result.ocrApplied());
    return result;
  }

  public boolean supports(Path path) {
    return DocumentFormat.fromExtension(DocumentFormat.extensionOf(path.getFileName().toString()))
        .isPresent();
  }
}
