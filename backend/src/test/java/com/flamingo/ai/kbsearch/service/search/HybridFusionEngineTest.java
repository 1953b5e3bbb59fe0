package com.flamingo.ai.kbsearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.kbsearch.config.SearchConfig;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVector;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocument;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocumentIndexService;
import com.flamingo.ai.kbsearch.elasticsearch.VectorSearchService;
import com.flamingo.ai.kbsearch.exception.EmbeddingErrorKind;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.embedding.QueryEmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HybridFusionEngineTest {

  private static final String MODEL = "sentence-transformer";
  private static final List<Float> EMBEDDING = List.of(0.1f, 0.2f, 0.3f);

  @Mock private LexicalDocumentIndexService lexicalIndex;
  @Mock private VectorSearchService vectorSearchService;
  @Mock private QueryEmbeddingService queryEmbeddingService;
  @Mock private EmbeddingModelRegistry modelRegistry;

  private SimpleMeterRegistry meterRegistry;
  private SearchConfig searchConfig;
  private HybridFusionEngine engine;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    searchConfig = new SearchConfig();
    engine = newEngine(new ResultDeduplicator());
    lenient().when(modelRegistry.resolve(any())).thenReturn(MODEL);
  }

  private HybridFusionEngine newEngine(ResultDeduplicator deduplicator) {
    return new HybridFusionEngine(
        new QueryRewriter(),
        lexicalIndex,
        vectorSearchService,
        queryEmbeddingService,
        modelRegistry,
        new SmartDateFilter(),
        deduplicator,
        searchConfig,
        meterRegistry);
  }

  private static SearchOptions options(int topK) {
    return new SearchOptions(topK, true, true, null);
  }

  private static LexicalDocument lexical(String id, double score) {
    return LexicalDocument.builder()
        .id(id)
        .path("/kb/Tecnico/" + id + ".pdf")
        .fileName(id + ".pdf")
        .content("lexical content of " + id)
        .relevanceScore(score)
        .build();
  }

  private static ChunkVector chunk(String documentId, double score, int page) {
    return ChunkVector.builder()
        .id(documentId + "-" + page)
        .documentId(documentId)
        .path("/kb/Tecnico/" + documentId + ".pdf")
        .fileName(documentId + ".pdf")
        .page(page)
        .text("chunk text of " + documentId + " page " + page)
        .relevanceScore(score)
        .build();
  }

  private void givenLexical(List<LexicalDocument> docs) {
    when(lexicalIndex.keywordSearch(anyMap(), anyString(), anyInt())).thenReturn(docs);
  }

  private void givenVector(List<ChunkVector> chunks) {
    when(queryEmbeddingService.embedQuery(anyString(), eq(MODEL))).thenReturn(EMBEDDING);
    when(vectorSearchService.search(eq(MODEL), anyMap(), eq(EMBEDDING), anyInt()))
        .thenReturn(chunks);
  }

  @Nested
  @DisplayName("fusion")
  class Fusion {

    @Test
    @DisplayName("should merge both sides per document with the max of normalized scores")
    void shouldMergeWithMaxScore() {
      givenLexical(List.of(lexical("A", 4.0), lexical("B", 2.0)));
      givenVector(List.of(chunk("C", 0.9, 2), chunk("A", 0.3, 5), chunk("A", 0.2, 7)));

      SearchResult result = engine.search("manutenzione impianti", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("A", "C", "B");
      SearchHit first = result.hits().get(0);
      assertThat(first.getScore()).isEqualTo(1.0);
      assertThat(first.getLexicalScore()).isEqualTo(1.0);
      assertThat(first.getVectorScore()).isEqualTo(0.3);
      assertThat(first.getPage()).isEqualTo(5);
      assertThat(first.getSnippet()).isEqualTo("chunk text of A page 5");
      assertThat(result.hits().get(2).getScore()).isEqualTo(0.5);
      assertThat(result.hits().get(2).getVectorScore()).isNull();
    }

    @Test
    @DisplayName("should rank a lexical hit before a vector-only hit on equal score")
    void shouldBreakTiesOnLexicalPresence() {
      givenLexical(List.of(lexical("L", 2.0)));
      givenVector(List.of(chunk("V", 1.0, 1)));

      SearchResult result = engine.search("verbale collaudo", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("L", "V");
    }

    @Test
    @DisplayName("should clamp vector scores into the unit interval")
    void shouldClampVectorScores() {
      List<SearchHit> hits = engine.fuse(List.of(), List.of(chunk("X", 1.7, 1), chunk("Y", -0.2, 1)));

      assertThat(hits).extracting(SearchHit::getScore).containsExactly(1.0, 0.0);
    }

    @Test
    @DisplayName("should cut long snippets")
    void shouldCutLongSnippets() {
      searchConfig.setSnippetChars(5);
      LexicalDocument doc = lexical("A", 1.0);
      doc.setContent("abcdefghij");

      List<SearchHit> hits = engine.fuse(List.of(doc), List.of());

      assertThat(hits.get(0).getSnippet()).isEqualTo("abcde...");
    }

    @Test
    @DisplayName("should truncate to topK")
    void shouldTruncateToTopK() {
      givenLexical(List.of(lexical("A", 3.0), lexical("B", 2.0), lexical("C", 1.0)));
      givenVector(List.of());

      SearchResult result = engine.search("relazione", Map.of(), options(2));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("A", "B");
      verify(lexicalIndex).keywordSearch(Map.of(), "relazione", 6);
    }
  }

  @Nested
  @DisplayName("degradation")
  class Degradation {

    @Test
    @DisplayName("should answer from vectors when the lexical backend fails")
    void shouldSurviveLexicalFailure() {
      when(lexicalIndex.keywordSearch(anyMap(), anyString(), anyInt()))
          .thenThrow(new RuntimeException("cluster unavailable"));
      givenVector(List.of(chunk("V", 0.8, 1)));

      SearchResult result = engine.search("offerta economica", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("V");
    }

    @Test
    @DisplayName("should answer lexically when the query cannot be embedded")
    void shouldSurviveMissingEmbedding() {
      givenLexical(List.of(lexical("A", 1.0)));
      when(queryEmbeddingService.embedQuery(anyString(), eq(MODEL))).thenReturn(List.of());

      SearchResult result = engine.search("offerta economica", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("A");
      verify(vectorSearchService, never()).search(anyString(), anyMap(), anyList(), anyInt());
    }

    @Test
    @DisplayName("should return raw hits without enhancement when post-processing fails")
    void shouldSurvivePostProcessingFailure() {
      ResultDeduplicator failing = mock(ResultDeduplicator.class);
      when(failing.deduplicate(anyList())).thenThrow(new IllegalStateException("boom"));
      engine = newEngine(failing);
      givenLexical(List.of(lexical("A", 2.0), lexical("B", 1.0)));
      givenVector(List.of());

      SearchResult result = engine.search("relazione", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("A", "B");
      assertThat(result.enhancement()).isEmpty();
      assertThat(meterRegistry.counter("search.postprocess.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should reject an unknown model")
    void shouldRejectUnknownModel() {
      when(modelRegistry.resolve("nope"))
          .thenThrow(new EmbeddingException(EmbeddingErrorKind.UNKNOWN_MODEL, "nope", "Unknown"));

      assertThatThrownBy(
              () -> engine.search("relazione", Map.of(), new SearchOptions(10, true, true, "nope")))
          .isInstanceOf(EmbeddingException.class);
    }
  }

  @Nested
  @DisplayName("enhancement")
  class Enhancement {

    @Test
    @DisplayName("should filter by the recognized year and search the cleaned query lexically")
    void shouldFilterByDate() {
      LexicalDocument older = lexical("old", 2.0);
      older.setYear(2020);
      LexicalDocument newer = lexical("new", 1.0);
      newer.setYear(2022);
      when(lexicalIndex.keywordSearch(Map.of(), "gare", 30)).thenReturn(List.of(older, newer));
      givenVector(List.of());

      SearchResult result = engine.search("gare dopo il 2021", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("new");
      EnhancementMetadata enhancement = result.enhancement().orElseThrow();
      assertThat(enhancement.cleanedQuery()).isEqualTo("gare");
      assertThat(enhancement.filteredByDate()).isTrue();
      assertThat(enhancement.removedByDateFilter()).isEqualTo(1);
      assertThat(enhancement.dateFilter()).isEqualTo(DateFilter.of(DateFilterType.AFTER, 2021));
      verify(queryEmbeddingService).embedQuery("gare dopo il 2021", MODEL);
    }

    @Test
    @DisplayName("should report the date filter without applying it when smart filtering is off")
    void shouldNotFilterWhenDisabled() {
      LexicalDocument older = lexical("old", 2.0);
      older.setYear(2020);
      givenLexical(List.of(older));
      givenVector(List.of());

      SearchResult result =
          engine.search("gare dopo il 2021", Map.of(), new SearchOptions(10, false, false, null));

      assertThat(result.hits()).hasSize(1);
      EnhancementMetadata enhancement = result.enhancement().orElseThrow();
      assertThat(enhancement.filteredByDate()).isFalse();
      assertThat(enhancement.deduplicated()).isFalse();
      assertThat(enhancement.dateFilter()).isNotNull();
    }

    @Test
    @DisplayName("should report removed duplicates")
    void shouldReportDuplicates() {
      LexicalDocument v1 = lexical("a", 1.0);
      v1.setFileName("Relazione_v1.pdf");
      LexicalDocument v2 = lexical("b", 1.0);
      v2.setFileName("Relazione_v2.pdf");
      givenLexical(List.of(v1, v2));
      givenVector(List.of());

      SearchResult result = engine.search("relazione", Map.of(), options(10));

      assertThat(result.hits()).extracting(SearchHit::getDocumentId).containsExactly("b");
      assertThat(result.enhancement().orElseThrow().removedDuplicates()).isEqualTo(1);
      assertThat(meterRegistry.counter("search.requests", "model", MODEL).count()).isEqualTo(1.0);
    }
  }
}
