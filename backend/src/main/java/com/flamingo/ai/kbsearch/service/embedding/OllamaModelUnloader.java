package com.flamingo.ai.kbsearch.service.embedding;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Evicts a model from an Ollama server's device memory.
 *
 * <p>Ollama keeps a model resident for {@code keep_alive} after each call; a request carrying
 * {@code keep_alive: 0} and no prompt unloads it immediately.
 */
@Component
@Slf4j
public class OllamaModelUnloader {

  private final RestClient restClient;
  private final MeterRegistry meterRegistry;

  public OllamaModelUnloader(RestClient.Builder restClientBuilder, MeterRegistry meterRegistry) {
    this.restClient = restClientBuilder.build();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Requests the unload. A failure is logged and counted; the next batch reloads the model either
   * way, so it never fails the batch that triggered it.
   */
  public void unload(String baseUrl, String modelName) {
    try {
      restClient
          .post()
          .uri(stripTrailingSlash(baseUrl) + "/api/generate")
          .contentType(MediaType.APPLICATION_JSON)
          .body(Map.of("model", modelName, "keep_alive", 0))
          .retrieve()
          .toBodilessEntity();
      log.debug("[EMBED] Unloaded '{}' from {}", modelName, baseUrl);
    } catch (RestClientException e) {
      meterRegistry.counter("embedding.device.release.failure", "model", modelName).increment();
      log.warn("[EMBED] Failed to unload '{}' from {}: {}", modelName, baseUrl, e.getMessage());
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
