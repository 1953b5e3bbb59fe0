package com.flamingo.ai.kbsearch.api.rest;

import com.flamingo.ai.kbsearch.api.dto.response.ModelResponse;
import com.flamingo.ai.kbsearch.domain.repository.IndexEntryRepository;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller listing the configured embedding models. */
@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

  private final EmbeddingModelRegistry modelRegistry;
  private final IndexEntryRepository indexEntryRepository;

  @GetMapping
  public ResponseEntity<List<ModelResponse>> models() {
    String defaultModel = modelRegistry.defaultModel();
    return ResponseEntity.ok(
        modelRegistry.specs().stream()
            .map(
                spec ->
                    ModelResponse.fromSpec(
                        spec,
                        spec.name().equals(defaultModel),
                        indexEntryRepository.countByModel(spec.name())))
            .toList());
  }
}
