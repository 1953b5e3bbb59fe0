package com.flamingo.ai.kbsearch.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.kbsearch.service.search.EnhancementMetadata;
import com.flamingo.ai.kbsearch.service.search.SearchHit;
import com.flamingo.ai.kbsearch.service.search.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a hybrid search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

  private String query;
  private List<SearchHit> hits;
  private int total;
  private EnhancementMetadata enhancement;

  public static SearchResponse fromResult(SearchResult result) {
    return SearchResponse.builder()
        .query(result.query())
        .hits(result.hits())
        .total(result.hits().size())
        .enhancement(result.enhancement().orElse(null))
        .build();
  }
}
