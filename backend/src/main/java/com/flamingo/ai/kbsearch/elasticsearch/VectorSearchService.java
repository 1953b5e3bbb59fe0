package com.flamingo.ai.kbsearch.elasticsearch;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Query-time kNN search over a model's chunk index; backend failures degrade to no candidates. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorSearchService {

  private final VectorIndexRegistry vectorIndexRegistry;
  private final MeterRegistry meterRegistry;

  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<ChunkVector> search(
      String model, Map<String, Object> filters, List<Float> queryEmbedding, int candidates) {
    return vectorIndexRegistry.forModel(model).vectorSearch(filters, queryEmbedding, candidates);
  }

  @SuppressWarnings("unused")
  private List<ChunkVector> vectorSearchFallback(
      String model,
      Map<String, Object> filters,
      List<Float> queryEmbedding,
      int candidates,
      Throwable t) {
    log.warn("[VECTOR] Search fallback for model '{}': {}", model, t.getMessage());
    meterRegistry.counter("chunk_vector.vector_search.fallback", "model", model).increment();
    return List.of();
  }
}
