package com.flamingo.ai.kbsearch.api.dto.response;

import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelSpec;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a configured embedding model. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelResponse {

  private String name;
  private EmbeddingProvider provider;
  private String modelName;
  private int dimensions;
  private String collection;
  private boolean defaultModel;
  private long indexedEntries;

  public static ModelResponse fromSpec(
      EmbeddingModelSpec spec, boolean defaultModel, long indexedEntries) {
    return ModelResponse.builder()
        .name(spec.name())
        .provider(spec.provider())
        .modelName(spec.modelName())
        .dimensions(spec.dimensions())
        .collection(spec.collection())
        .defaultModel(defaultModel)
        .indexedEntries(indexedEntries)
        .build();
  }
}
