package com.flamingo.ai.kbsearch.api.rest;

import com.flamingo.ai.kbsearch.api.dto.request.SearchRequest;
import com.flamingo.ai.kbsearch.api.dto.response.SearchResponse;
import com.flamingo.ai.kbsearch.config.SearchConfig;
import com.flamingo.ai.kbsearch.exception.InvalidRequestException;
import com.flamingo.ai.kbsearch.service.search.FilterExpressionParser;
import com.flamingo.ai.kbsearch.service.search.HybridFusionEngine;
import com.flamingo.ai.kbsearch.service.search.SearchOptions;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for hybrid search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final HybridFusionEngine fusionEngine;
  private final FilterExpressionParser filterParser;
  private final SearchConfig searchConfig;

  /** Searches with a JSON body. */
  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    Map<String, Object> filters = filterParser.normalize(request.getFilters());
    return ResponseEntity.ok(
        execute(
            request.getQuery(),
            filters,
            request.getTopK(),
            request.getDeduplicate(),
            request.getSmartFilter(),
            request.getModel()));
  }

  /** Searches with query parameters; filters use the {@code key:value,...} expression. */
  @GetMapping
  public ResponseEntity<SearchResponse> searchGet(
      @RequestParam("q") String query,
      @RequestParam(value = "filters", required = false) String filters,
      @RequestParam(value = "topK", required = false) Integer topK,
      @RequestParam(value = "deduplicate", required = false) Boolean deduplicate,
      @RequestParam(value = "smartFilter", required = false) Boolean smartFilter,
      @RequestParam(value = "model", required = false) String model) {
    if (query.isBlank()) {
      throw new InvalidRequestException("Query is required");
    }
    if (topK != null && (topK < 1 || topK > searchConfig.getMaxTopK())) {
      throw new InvalidRequestException(
          "topK must be between 1 and " + searchConfig.getMaxTopK());
    }
    return ResponseEntity.ok(
        execute(query, filterParser.parse(filters), topK, deduplicate, smartFilter, model));
  }

  private SearchResponse execute(
      String query,
      Map<String, Object> filters,
      Integer topK,
      Boolean deduplicate,
      Boolean smartFilter,
      String model) {
    SearchOptions options =
        new SearchOptions(
            topK != null ? topK : searchConfig.getDefaultTopK(),
            deduplicate != null ? deduplicate : searchConfig.isDeduplicateByDefault(),
            smartFilter != null ? smartFilter : searchConfig.isSmartFilterByDefault(),
            model);
    return SearchResponse.fromResult(fusionEngine.search(query, filters, options));
  }
}
