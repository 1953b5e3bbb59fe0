package com.flamingo.ai.kbsearch.service.embedding;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds LangChain4j embedding models for a configured model and execution path. */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingBackendFactory {

  private final OllamaModelUnloader ollamaModelUnloader;

  public EmbeddingBackend create(String name, IngestionConfig.Model model, ExecutionPath path) {
    EmbeddingProvider provider = EmbeddingProvider.fromConfig(model.getProvider());
    EmbeddingModel embeddingModel =
        switch (provider) {
          case IN_PROCESS -> new AllMiniLmL6V2EmbeddingModel();
          case OLLAMA ->
              OllamaEmbeddingModel.builder()
                  .baseUrl(baseUrlFor(model, path))
                  .modelName(model.getModelName())
                  .timeout(model.getTimeout())
                  .build();
          case OPENAI ->
              OpenAiEmbeddingModel.builder()
                  .apiKey(model.getApiKey())
                  .modelName(model.getModelName())
                  .dimensions(model.getDimensions())
                  .timeout(model.getTimeout())
                  .build();
        };
    log.info("[EMBED] Created {} backend for '{}' on {} path", provider, name, path);
    return new LangChain4jEmbeddingBackend(
        name, embeddingModel, memoryRelease(provider, model, path));
  }

  /** Only a local Ollama server on the accelerated path holds device memory on our behalf. */
  Runnable memoryRelease(
      EmbeddingProvider provider, IngestionConfig.Model model, ExecutionPath path) {
    if (provider != EmbeddingProvider.OLLAMA || path != ExecutionPath.ACCELERATED) {
      return null;
    }
    String baseUrl = baseUrlFor(model, path);
    String modelName = model.getModelName();
    return () -> ollamaModelUnloader.unload(baseUrl, modelName);
  }

  static String baseUrlFor(IngestionConfig.Model model, ExecutionPath path) {
    String accelerated = model.getAcceleratedBaseUrl();
    String cpu = model.getCpuBaseUrl();
    if (path == ExecutionPath.ACCELERATED && accelerated != null) {
      return accelerated;
    }
    return cpu != null ? cpu : accelerated;
  }
}
