package com.flamingo.ai.kbsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.kbsearch.config.SearchConfig;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * The lexical (BM25) document index: one Elasticsearch document per corpus document, with keyword
 * fields for structured filters and analyzed text over file name, subject and content.
 */
@Service
@Slf4j
public class LexicalDocumentIndexService
    extends AbstractElasticsearchIndexService<LexicalDocument> {

  private static final List<String> KEYWORD_FIELDS =
      List.of("path", "extension", "area", "client", "docType", "category", "lot", "version",
          "contentHash");

  private final String indexName;
  private final String textAnalyzer;

  @Autowired
  public LexicalDocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      SearchConfig searchConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        searchConfig.getLexicalIndex(),
        searchConfig.getTextAnalyzer());
  }

  @VisibleForTesting
  public LexicalDocumentIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      String textAnalyzer) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.textAnalyzer = textAnalyzer;
  }

  @PostConstruct
  @Override
  public void initIndex() {
    super.initIndex();
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    for (String field : KEYWORD_FIELDS) {
      properties.put(field, Property.of(p -> p.keyword(k -> k)));
    }
    properties.put("year", Property.of(p -> p.integer(i -> i)));
    properties.put("fileName", analyzedText());
    properties.put("subject", analyzedText());
    properties.put("content", analyzedText());
    return properties;
  }

  private Property analyzedText() {
    return Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer))));
  }

  @Override
  protected Map<String, Object> convertToDocument(LexicalDocument doc) {
    Map<String, Object> document = new HashMap<>();
    document.put("path", doc.getPath());
    document.put("fileName", doc.getFileName());
    document.put("extension", doc.getExtension());
    document.put("contentHash", doc.getContentHash());
    document.put("content", doc.getContent());
    putIfPresent(document, "area", doc.getArea());
    putIfPresent(document, "year", doc.getYear());
    putIfPresent(document, "client", doc.getClient());
    putIfPresent(document, "subject", doc.getSubject());
    putIfPresent(document, "docType", doc.getDocType());
    putIfPresent(document, "category", doc.getCategory());
    putIfPresent(document, "lot", doc.getLot());
    putIfPresent(document, "version", doc.getVersion());
    return document;
  }

  private static void putIfPresent(Map<String, Object> document, String field, Object value) {
    if (value != null) {
      document.put(field, value);
    }
  }

  @Override
  protected LexicalDocument convertFromDocument(Map<String, Object> source) {
    return LexicalDocument.builder()
        .id(SearchFilterQueries.asString(source.get("id")))
        .path(SearchFilterQueries.asString(source.get("path")))
        .fileName(SearchFilterQueries.asString(source.get("fileName")))
        .extension(SearchFilterQueries.asString(source.get("extension")))
        .area(SearchFilterQueries.asString(source.get("area")))
        .year(SearchFilterQueries.asInteger(source.get("year")))
        .client(SearchFilterQueries.asString(source.get("client")))
        .subject(SearchFilterQueries.asString(source.get("subject")))
        .docType(SearchFilterQueries.asString(source.get("docType")))
        .category(SearchFilterQueries.asString(source.get("category")))
        .lot(SearchFilterQueries.asString(source.get("lot")))
        .version(SearchFilterQueries.asString(source.get("version")))
        .contentHash(SearchFilterQueries.asString(source.get("contentHash")))
        .content(SearchFilterQueries.asString(source.get("content")))
        .build();
  }

  @Override
  protected String getDocumentId(LexicalDocument entity) {
    return entity.getId();
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object documentId = criteria.get("documentId");
    if (documentId == null) {
      throw new IllegalArgumentException("deleteBy requires documentId in criteria");
    }
    return Query.of(q -> q.ids(i -> i.values(documentId.toString())));
  }

  @Override
  protected String getMetricPrefix() {
    return "lexical";
  }

  /**
   * BM25 search over file name, subject and content, restricted by the structured filters. A blank
   * query matches every document that passes the filters. Backend failures degrade to no
   * candidates.
   */
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<LexicalDocument> keywordSearch(
      Map<String, Object> filters, String query, int candidates) {
    List<Query> filterQueries = SearchFilterQueries.toFilterQueries(filters);
    Query match =
        query == null || query.isBlank()
            ? Query.of(q -> q.matchAll(m -> m))
            : Query.of(
                q ->
                    q.multiMatch(
                        mm ->
                            mm.fields("fileName^2.0", "subject^1.5", "content")
                                .query(query)
                                .type(TextQueryType.BestFields)
                                .tieBreaker(0.3)));

    log.debug("[LEXICAL] query='{}' filters={} candidates={}", query, filters, candidates);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(q -> q.bool(b -> b.filter(filterQueries).must(match)))
                    .size(candidates));
    return executeSearch(request, "keyword_search");
  }

  @SuppressWarnings("unused")
  private List<LexicalDocument> keywordSearchFallback(
      Map<String, Object> filters, String query, int candidates, Throwable t) {
    log.warn("{} keyword search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  public void deleteByDocumentId(UUID documentId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("documentId", documentId);
    deleteBy(criteria);
  }
}
