package com.flamingo.ai.kbsearch.service.embedding;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.EmbeddingErrorKind;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Configured embedding models and their backends. Backends are created on first use and cached per
 * (model, execution path). In-process models share one instance across both paths.
 */
@Component
public class EmbeddingModelRegistry {

  private final IngestionConfig ingestionConfig;
  private final EmbeddingBackendFactory backendFactory;
  private final Map<String, EmbeddingBackend> backends = new ConcurrentHashMap<>();

  public EmbeddingModelRegistry(
      IngestionConfig ingestionConfig, EmbeddingBackendFactory backendFactory) {
    this.ingestionConfig = ingestionConfig;
    this.backendFactory = backendFactory;
  }

  /**
   * Looks up a model by its configured name.
   *
   * @throws EmbeddingException with {@link EmbeddingErrorKind#UNKNOWN_MODEL}
   */
  public EmbeddingModelSpec spec(String name) {
    IngestionConfig.Model model = config(name);
    return toSpec(name, model);
  }

  public List<EmbeddingModelSpec> specs() {
    List<EmbeddingModelSpec> specs = new ArrayList<>();
    ingestionConfig.getEmbedding().getModels().forEach((name, model) -> specs.add(toSpec(name, model)));
    return specs;
  }

  public String defaultModel() {
    return ingestionConfig.getEmbedding().getDefaultModel();
  }

  /** Resolves a possibly blank model name to a configured one. */
  public String resolve(String name) {
    String resolved = name == null || name.isBlank() ? defaultModel() : name;
    config(resolved);
    return resolved;
  }

  public EmbeddingBackend backend(String name, ExecutionPath path) {
    IngestionConfig.Model model = config(name);
    ExecutionPath effective =
        EmbeddingProvider.fromConfig(model.getProvider()) == EmbeddingProvider.IN_PROCESS
            ? ExecutionPath.CPU
            : path;
    return backends.computeIfAbsent(
        name + "|" + effective, key -> backendFactory.create(name, model, effective));
  }

  private IngestionConfig.Model config(String name) {
    IngestionConfig.Model model = ingestionConfig.getEmbedding().getModels().get(name);
    if (model == null) {
      throw new EmbeddingException(
          EmbeddingErrorKind.UNKNOWN_MODEL, name, "Unknown embedding model: " + name);
    }
    return model;
  }

  private static EmbeddingModelSpec toSpec(String name, IngestionConfig.Model model) {
    String collection = model.getCollection() != null ? model.getCollection() : "kb_" + name + "_docs";
    return new EmbeddingModelSpec(
        name,
        EmbeddingProvider.fromConfig(model.getProvider()),
        model.getModelName(),
        model.getDimensions(),
        collection);
  }
}
