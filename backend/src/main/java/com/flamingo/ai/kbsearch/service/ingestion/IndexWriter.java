package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVector;
import com.flamingo.ai.kbsearch.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocument;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocumentIndexService;
import com.flamingo.ai.kbsearch.exception.IndexWriteException;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes to the vector and lexical indexes with bounded linear backoff on transient failures. A
 * permanent rejection is rethrown on the first attempt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexWriter {

  private final LexicalDocumentIndexService lexicalIndex;
  private final IngestionConfig ingestionConfig;

  public void writeVectors(ElasticsearchIndexOperations<ChunkVector> index, List<ChunkVector> points) {
    if (points.isEmpty()) {
      return;
    }
    write(index, points);
  }

  public void writeLexical(LexicalDocument document) {
    write(lexicalIndex, List.of(document));
  }

  private <T> void write(ElasticsearchIndexOperations<T> index, List<T> documents) {
    int maxAttempts = Math.max(1, ingestionConfig.getOrchestrator().getIndexWriteRetries());
    Duration backoff = ingestionConfig.getOrchestrator().getIndexWriteBackoff();
    for (int attempt = 1; ; attempt++) {
      try {
        index.indexDocuments(documents);
        return;
      } catch (IndexWriteException e) {
        if (!e.isTransient() || attempt >= maxAttempts) {
          throw e;
        }
        log.warn(
            "[INDEX] Transient write failure on {}, retry {}/{}: {}",
            index.getIndexName(),
            attempt,
            maxAttempts,
            e.getMessage());
        sleep(backoff.multipliedBy(attempt));
      }
    }
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during index write backoff", e);
    }
  }
}
