package com.flamingo.ai.kbsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.kbsearch.exception.EmbeddingErrorKind;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelSpec;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Holds one {@link ChunkVectorIndexService} per configured embedding model. */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorIndexRegistry {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final EmbeddingModelRegistry modelRegistry;

  private final Map<String, ChunkVectorIndexService> indexes = new LinkedHashMap<>();

  @PostConstruct
  public void initIndexes() {
    for (EmbeddingModelSpec spec : modelRegistry.specs()) {
      ChunkVectorIndexService service =
          new ChunkVectorIndexService(
              elasticsearchClient, meterRegistry, spec.collection(), spec.dimensions());
      service.initIndex();
      indexes.put(spec.name(), service);
      log.info(
          "[INDEX] Vector index '{}' ready for model '{}' ({} dims)",
          spec.collection(),
          spec.name(),
          spec.dimensions());
    }
  }

  /**
   * Returns the vector index of a model.
   *
   * @throws EmbeddingException with {@link EmbeddingErrorKind#UNKNOWN_MODEL}
   */
  public ChunkVectorIndexService forModel(String model) {
    ChunkVectorIndexService service = indexes.get(model);
    if (service == null) {
      throw new EmbeddingException(
          EmbeddingErrorKind.UNKNOWN_MODEL, model, "No vector index configured for " + model);
    }
    return service;
  }

  public Map<String, ChunkVectorIndexService> all() {
    return Collections.unmodifiableMap(indexes);
  }
}
