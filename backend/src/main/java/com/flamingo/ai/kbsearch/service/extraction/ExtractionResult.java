package com.flamingo.ai.kbsearch.service.extraction;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Text extracted from one document.
 *
 * @param text full text, pages joined by blank lines
 * @param pages 1-based page number to page text; non-paginated formats use page 1
 * @param method strategy that produced the text
 * @param ocrApplied whether any of the text came from OCR
 */
public record ExtractionResult(
    String text, SortedMap<Integer, String> pages, ExtractionMethod method, boolean ocrApplied) {

  public static ExtractionResult ofPages(
      SortedMap<Integer, String> pages, ExtractionMethod method, boolean ocrApplied) {
    SortedMap<Integer, String> cleaned = new TreeMap<>();
    pages.forEach((page, content) -> cleaned.put(page, TextCleaner.clean(content)));
    String text =
        cleaned.values().stream().filter(s -> !s.isEmpty()).collect(Collectors.joining("\n\n"));
    return new ExtractionResult(
        text, Collections.unmodifiableSortedMap(cleaned), method, ocrApplied);
  }

  public static ExtractionResult singlePage(
      String content, ExtractionMethod method, boolean ocrApplied) {
    SortedMap<Integer, String> pages = new TreeMap<>();
    pages.put(1, content);
    return ofPages(pages, method, ocrApplied);
  }

  public int pageCount() {
    return pages.size();
  }

  public boolean isBlank() {
    return text.isBlank();
  }
}
