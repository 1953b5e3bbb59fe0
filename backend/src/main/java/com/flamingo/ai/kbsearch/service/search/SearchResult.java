package com.flamingo.ai.kbsearch.service.search;

import java.util.List;
import java.util.Optional;

/** Ranked hits; the enhancement block is absent when post-processing failed. */
public record SearchResult(
    String query, List<SearchHit> hits, Optional<EnhancementMetadata> enhancement) {}
