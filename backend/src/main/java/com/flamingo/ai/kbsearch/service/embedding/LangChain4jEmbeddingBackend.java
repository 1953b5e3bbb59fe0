package com.flamingo.ai.kbsearch.service.embedding;

import com.flamingo.ai.kbsearch.exception.EmbeddingErrorKind;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** {@link EmbeddingBackend} over a LangChain4j {@link EmbeddingModel}. */
public class LangChain4jEmbeddingBackend implements EmbeddingBackend {

  private static final List<String> ALLOCATION_MARKERS =
      List.of("out of memory", "cuda", "oom", "failed to allocate", "insufficient memory");

  private final String modelName;
  private final EmbeddingModel embeddingModel;
  private final Runnable memoryRelease;

  public LangChain4jEmbeddingBackend(String modelName, EmbeddingModel embeddingModel) {
    this(modelName, embeddingModel, null);
  }

  /**
   * @param memoryRelease evicts the model from the device after a batch, or {@code null} when the
   *     backend holds no device memory
   */
  public LangChain4jEmbeddingBackend(
      String modelName, EmbeddingModel embeddingModel, Runnable memoryRelease) {
    this.modelName = modelName;
    this.embeddingModel = embeddingModel;
    this.memoryRelease = memoryRelease;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<TextSegment> segments = new ArrayList<>(texts.size());
    for (String text : texts) {
      segments.add(TextSegment.from(text));
    }
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      if (isAllocationFailure(e)) {
        throw new DeviceAllocationException(
            "Device allocation failed for " + texts.size() + " texts on " + modelName, e);
      }
      throw new EmbeddingException(
          EmbeddingErrorKind.BACKEND_FAILURE, modelName, "Embedding call failed: " + e.getMessage(),
          e);
    }

    List<float[]> vectors = new ArrayList<>(response.content().size());
    for (Embedding embedding : response.content()) {
      vectors.add(embedding.vector());
    }
    return vectors;
  }

  @Override
  public void releaseDeviceMemory() {
    if (memoryRelease != null) {
      memoryRelease.run();
    }
  }

  static boolean isAllocationFailure(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      String message = t.getMessage();
      if (message == null) {
        continue;
      }
      String lower = message.toLowerCase(Locale.ROOT);
      for (String marker : ALLOCATION_MARKERS) {
        if (lower.contains(marker)) {
          return true;
        }
      }
    }
    return false;
  }
}
