package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.service.extraction.ExtractionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Sliding-window chunking within page boundaries. A window that would end mid-sentence is pulled
 * back to the last period or newline, provided that keeps at least half the window.
 */
@Component
@RequiredArgsConstructor
public class TextChunker {

  private final IngestionConfig ingestionConfig;

  public List<TextChunk> chunk(ExtractionResult extraction) {
    int size = ingestionConfig.getChunking().getSize();
    int overlap = Math.min(ingestionConfig.getChunking().getOverlap(), size / 2);
    List<TextChunk> chunks = new ArrayList<>();
    for (Map.Entry<Integer, String> page : extraction.pages().entrySet()) {
      for (String piece : split(page.getValue(), size, overlap)) {
        chunks.add(new TextChunk(chunks.size(), page.getKey(), piece));
      }
    }
    return chunks;
  }

  static List<String> split(String text, int size, int overlap) {
    List<String> pieces = new ArrayList<>();
    int length = text.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + size, length);
      if (end < length) {
        int boundary = Math.max(text.lastIndexOf('.', end - 1), text.lastIndexOf('\n', end - 1));
        if (boundary >= start + size / 2) {
          end = boundary + 1;
        }
      }
      String piece = text.substring(start, end).strip();
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
      if (end >= length) {
        break;
      }
      start = Math.max(end - overlap, start + 1);
    }
    return pieces;
  }
}
