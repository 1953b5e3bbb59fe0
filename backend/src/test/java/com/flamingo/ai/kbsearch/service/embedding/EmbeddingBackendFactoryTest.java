package com.flamingo.ai.kbsearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingBackendFactoryTest {

  @Mock private OllamaModelUnloader ollamaModelUnloader;

  private EmbeddingBackendFactory factory;
  private IngestionConfig.Model ollama;

  @BeforeEach
  void setUp() {
    factory = new EmbeddingBackendFactory(ollamaModelUnloader);
    ollama = new IngestionConfig.Model();
    ollama.setProvider("ollama");
    ollama.setModelName("llama3");
    ollama.setAcceleratedBaseUrl("http://gpu:11434");
    ollama.setCpuBaseUrl("http://cpu:11435");
  }

  @Test
  @DisplayName("should unload the model from the accelerated Ollama server")
  void shouldReleaseAcceleratedOllama() {
    Runnable release =
        factory.memoryRelease(EmbeddingProvider.OLLAMA, ollama, ExecutionPath.ACCELERATED);

    assertThat(release).isNotNull();
    release.run();
    verify(ollamaModelUnloader).unload("http://gpu:11434", "llama3");
  }

  @Test
  @DisplayName("should hold nothing to release on the CPU path or for hosted models")
  void shouldHaveNoReleaseElsewhere() {
    assertThat(factory.memoryRelease(EmbeddingProvider.OLLAMA, ollama, ExecutionPath.CPU)).isNull();
    assertThat(
            factory.memoryRelease(
                EmbeddingProvider.OPENAI, new IngestionConfig.Model(), ExecutionPath.ACCELERATED))
        .isNull();
    assertThat(
            factory.memoryRelease(
                EmbeddingProvider.IN_PROCESS, new IngestionConfig.Model(), ExecutionPath.CPU))
        .isNull();
  }

  @Test
  @DisplayName("should fall back to the other base URL when one is missing")
  void shouldResolveBaseUrl() {
    assertThat(EmbeddingBackendFactory.baseUrlFor(ollama, ExecutionPath.CPU))
        .isEqualTo("http://cpu:11435");
    ollama.setCpuBaseUrl(null);
    assertThat(EmbeddingBackendFactory.baseUrlFor(ollama, ExecutionPath.CPU))
        .isEqualTo("http://gpu:11434");
  }
}
