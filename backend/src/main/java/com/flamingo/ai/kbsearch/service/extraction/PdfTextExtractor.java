package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * PDF text layer via PDFBox, page by page. When the whole document is near-empty (a scan), the
 * first {@code ocrMaxPages} pages are rasterized and passed through OCR.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfTextExtractor implements FormatExtractor {

  private final IngestionConfig ingestionConfig;
  private final OcrFallbackPolicy ocrFallbackPolicy;
  private final OcrEngine ocrEngine;

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.PDF;
  }

  @Override
  public ExtractionResult extract(Path path, DocumentFormat format) {
    try (PDDocument pdf = Loader.loadPDF(path.toFile())) {
      SortedMap<Integer, String> pages = extractTextLayer(pdf);
      String nativeText = String.join("\n", pages.values());
      if (!ocrFallbackPolicy.isNearEmpty(nativeText, pages.size())) {
        return ExtractionResult.ofPages(pages, ExtractionMethod.PDF, false);
      }

      log.info(
          "[EXTRACT] Near-empty text layer in {} ({} pages), applying OCR",
          path.getFileName(),
          pages.size());
      try {
        return ExtractionResult.ofPages(ocrPages(pdf, pages), ExtractionMethod.PDF, true);
      } catch (ExtractionException e) {
        if (nativeText.isBlank()) {
          throw e;
        }
        log.warn("[EXTRACT] OCR failed for {}, keeping text layer: {}", path, e.getDetail());
        return ExtractionResult.ofPages(pages, ExtractionMethod.PDF, false);
      }
    } catch (InvalidPasswordException e) {
      throw new ExtractionException(
          ExtractionErrorKind.PASSWORD_PROTECTED, "PDF is encrypted: " + path.getFileName(), e);
    } catch (IOException e) {
      throw new ExtractionException(ExtractionErrorKind.CORRUPT_FILE, e.getMessage(), e);
    }
  }

  private SortedMap<Integer, String> extractTextLayer(PDDocument pdf) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setSortByPosition(true);
    SortedMap<Integer, String> pages = new TreeMap<>();
    for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      pages.put(page, stripper.getText(pdf));
    }
    return pages;
  }

  private SortedMap<Integer, String> ocrPages(PDDocument pdf, SortedMap<Integer, String> nativePages)
      throws IOException {
    IngestionConfig.Extraction config = ingestionConfig.getExtraction();
    PDFRenderer renderer = new PDFRenderer(pdf);
    SortedMap<Integer, String> result = new TreeMap<>(nativePages);
    int limit = Math.min(pdf.getNumberOfPages(), config.getOcrMaxPages());
    for (int page = 1; page <= limit; page++) {
      if (!ocrFallbackPolicy.isPageNearEmpty(nativePages.get(page))) {
        continue;
      }
      BufferedImage image =
          renderer.renderImageWithDPI(page - 1, config.getOcrDpi(), ImageType.GRAY);
      Path png = Files.createTempFile("kbsearch-ocr-", ".png");
      try {
        ImageIO.write(image, "png", png.toFile());
        result.put(page, ocrEngine.recognize(png));
      } finally {
        Files.deleteIfExists(png);
      }
    }
    return result;
  }
}
