package com.flamingo.ai.kbsearch.service.embedding;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds search queries through the dispatcher's stateless query call. A failing backend yields an
 * empty vector and the search goes lexical.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryEmbeddingService {

  // Queries are short; anything longer is pasted text and gets cut
  private static final int MAX_QUERY_CHARS = 2000;

  private final EmbeddingDispatcher embeddingDispatcher;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String query, String model) {
    String text = query.length() > MAX_QUERY_CHARS ? query.substring(0, MAX_QUERY_CHARS) : query;
    List<Float> vector = embeddingDispatcher.embedQuery(text, model);
    meterRegistry.counter("embedding.query.success", "model", model).increment();
    return vector;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, String model, Throwable t) {
    log.warn("[EMBED] Query embedding failed for '{}': {}", model, t.getMessage());
    meterRegistry.counter("embedding.query.failure", "model", model).increment();
    return List.of();
  }
}
