package com.flamingo.ai.kbsearch.service.search;

import com.flamingo.ai.kbsearch.config.SearchConfig;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVector;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocument;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocumentIndexService;
import com.flamingo.ai.kbsearch.elasticsearch.VectorSearchService;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.embedding.QueryEmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid search: BM25 over the lexical index and kNN over the model's chunk index, merged per
 * document with {@code max(lexical, vector)} after normalizing both sides to [0, 1].
 *
 * <p>Either backend may fail; the other one then carries the query alone. The indexes are only
 * read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridFusionEngine {

  private final QueryRewriter queryRewriter;
  private final LexicalDocumentIndexService lexicalIndex;
  private final VectorSearchService vectorSearchService;
  private final QueryEmbeddingService queryEmbeddingService;
  private final EmbeddingModelRegistry modelRegistry;
  private final SmartDateFilter smartDateFilter;
  private final ResultDeduplicator resultDeduplicator;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;

  /** Merge state of one document. */
  private static final class Fused {
    SearchHit hit;
    int lexicalRank = Integer.MAX_VALUE;
    int vectorRank = Integer.MAX_VALUE;
  }

  private static final Comparator<Fused> RANKING =
      Comparator.<Fused>comparingDouble(f -> f.hit.getScore())
          .reversed()
          .thenComparing(f -> f.hit.getLexicalScore() == null)
          .thenComparingInt(f -> f.lexicalRank)
          .thenComparingInt(f -> f.vectorRank);

  @Timed(value = "search.hybrid", description = "Time for hybrid search")
  public SearchResult search(String query, Map<String, Object> filters, SearchOptions options) {
    String model = modelRegistry.resolve(options.model());
    int topK = Math.max(1, Math.min(options.topK(), searchConfig.getMaxTopK()));
    int candidates =
        Math.min(topK * searchConfig.getCandidateMultiplier(), searchConfig.getMaxCandidates());

    RewrittenQuery rewritten = queryRewriter.rewrite(query);
    List<LexicalDocument> lexical = lexicalCandidates(filters, rewritten.cleanedQuery(), candidates);
    List<ChunkVector> vector = vectorCandidates(model, filters, rewritten.original(), candidates);
    List<SearchHit> fused = fuse(lexical, vector);
    log.debug(
        "[FUSION] lexical={} vector={} fused={} topK={}",
        lexical.size(),
        vector.size(),
        fused.size(),
        topK);

    List<SearchHit> hits = fused;
    Optional<EnhancementMetadata> enhancement;
    try {
      DateFilter dateFilter = rewritten.dateFilter().orElse(null);
      int removedByDate = 0;
      boolean filteredByDate = options.smartFilter() && dateFilter != null;
      if (filteredByDate) {
        SmartDateFilter.Outcome outcome = smartDateFilter.apply(hits, dateFilter);
        hits = outcome.hits();
        removedByDate = outcome.removed();
      }
      int removedDuplicates = 0;
      if (options.deduplicate()) {
        ResultDeduplicator.Outcome outcome = resultDeduplicator.deduplicate(hits);
        hits = outcome.hits();
        removedDuplicates = outcome.removed();
      }
      enhancement =
          Optional.of(
              new EnhancementMetadata(
                  rewritten.cleanedQuery(),
                  dateFilter,
                  filteredByDate,
                  removedByDate,
                  options.deduplicate(),
                  removedDuplicates));
    } catch (RuntimeException e) {
      log.warn("[FUSION] Post-processing failed, returning raw hits: {}", e.getMessage());
      meterRegistry.counter("search.postprocess.failure").increment();
      hits = fused;
      enhancement = Optional.empty();
    }

    List<SearchHit> page = hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    meterRegistry.counter("search.requests", "model", model).increment();
    return new SearchResult(query, page, enhancement);
  }

  private List<LexicalDocument> lexicalCandidates(
      Map<String, Object> filters, String cleanedQuery, int candidates) {
    try {
      return lexicalIndex.keywordSearch(filters, cleanedQuery, candidates);
    } catch (RuntimeException e) {
      log.warn("[FUSION] Lexical search failed, continuing vector-only: {}", e.getMessage());
      return List.of();
    }
  }

  private List<ChunkVector> vectorCandidates(
      String model, Map<String, Object> filters, String originalQuery, int candidates) {
    if (originalQuery.isBlank()) {
      return List.of();
    }
    try {
      List<Float> embedding = queryEmbeddingService.embedQuery(originalQuery, model);
      if (embedding.isEmpty()) {
        log.warn("[FUSION] No query embedding, continuing lexical-only");
        return List.of();
      }
      return vectorSearchService.search(model, filters, embedding, candidates);
    } catch (RuntimeException e) {
      log.warn("[FUSION] Vector search failed, continuing lexical-only: {}", e.getMessage());
      return List.of();
    }
  }

  List<SearchHit> fuse(List<LexicalDocument> lexical, List<ChunkVector> vector) {
    Map<String, Fused> merged = new LinkedHashMap<>();

    double maxLexical =
        lexical.stream().mapToDouble(d -> score(d.getRelevanceScore())).max().orElse(0.0);
    for (int rank = 0; rank < lexical.size(); rank++) {
      LexicalDocument doc = lexical.get(rank);
      if (merged.containsKey(doc.getId())) {
        continue;
      }
      double normalized = maxLexical > 0 ? score(doc.getRelevanceScore()) / maxLexical : 0.0;
      Fused fused = new Fused();
      fused.lexicalRank = rank;
      fused.hit =
          SearchHit.builder()
              .documentId(doc.getId())
              .path(doc.getPath())
              .fileName(doc.getFileName())
              .lexicalScore(normalized)
              .score(normalized)
              .snippet(snippet(doc.getContent()))
              .area(doc.getArea())
              .year(doc.getYear())
              .client(doc.getClient())
              .subject(doc.getSubject())
              .docType(doc.getDocType())
              .category(doc.getCategory())
              .extension(doc.getExtension())
              .lot(doc.getLot())
              .version(doc.getVersion())
              .build();
      merged.put(doc.getId(), fused);
    }

    // Chunks arrive best first, so the first chunk seen for a document is its best
    int vectorRank = 0;
    for (ChunkVector chunk : vector) {
      String documentId = chunk.getDocumentId();
      Fused fused = merged.get(documentId);
      if (fused != null && fused.hit.getVectorScore() != null) {
        continue;
      }
      double normalized = Math.max(0.0, Math.min(1.0, score(chunk.getRelevanceScore())));
      if (fused == null) {
        fused = new Fused();
        fused.hit =
            SearchHit.builder()
                .documentId(documentId)
                .path(chunk.getPath())
                .fileName(chunk.getFileName())
                .score(normalized)
                .area(chunk.getArea())
                .year(chunk.getYear())
                .client(chunk.getClient())
                .subject(chunk.getSubject())
                .docType(chunk.getDocType())
                .category(chunk.getCategory())
                .extension(chunk.getExtension())
                .lot(chunk.getLot())
                .build();
        merged.put(documentId, fused);
      }
      fused.vectorRank = vectorRank++;
      fused.hit.setVectorScore(normalized);
      fused.hit.setScore(Math.max(fused.hit.getScore(), normalized));
      fused.hit.setPage(chunk.getPage());
      fused.hit.setSnippet(snippet(chunk.getText()));
    }

    List<Fused> ranked = new ArrayList<>(merged.values());
    ranked.sort(RANKING);
    return ranked.stream().map(f -> f.hit).toList();
  }

  private String snippet(String text) {
    if (text == null) {
      return null;
    }
    int limit = searchConfig.getSnippetChars();
    return text.length() > limit ? text.substring(0, limit) + "..." : text;
  }

  private static double score(Double value) {
    return value == null ? 0.0 : value;
  }
}
