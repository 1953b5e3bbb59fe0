package com.flamingo.ai.kbsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.kbsearch.exception.IndexWriteException;
import com.flamingo.ai.kbsearch.exception.SearchException;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Owns index creation and mapping validation, bulk upserts and hit mapping. Subclasses define
 * the schema and the conversion between their document type and the stored source.
 *
 * <p>Writes never degrade silently: an unacknowledged bulk item raises {@link
 * IndexWriteException}, transient for I/O errors, throttling and server errors, permanent for
 * document or mapping rejections.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /** Metric prefix for this index, e.g. "lexical" or "chunk_vector". */
  protected abstract String getMetricPrefix();

  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // Undeclared fields are stored in _source but never mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields. Type mismatches fail fast so the index can be recreated manually.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual != null && entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      log.error("Mapping mismatch in index '{}': {}", getIndexName(), mismatches);
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s): "
              + String.join("; ", mismatches)
              + ". Delete the index and restart to apply correct mappings.");
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException e) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw IndexWriteException.transientFailure(
          getIndexName(), "Bulk request to " + getIndexName() + " failed: " + e.getMessage(), e);
    } catch (ElasticsearchException e) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      if (isTransientStatus(e.status())) {
        throw IndexWriteException.transientFailure(
            getIndexName(), "Bulk request rejected with status " + e.status(), e);
      }
      throw new IndexWriteException(
          getIndexName(), false, "Bulk request rejected: " + e.getMessage(), e);
    }

    if (response.errors()) {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
      throw classifyItemFailures(response.items());
    }
    log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  private IndexWriteException classifyItemFailures(List<BulkResponseItem> items) {
    boolean allTransient = true;
    String firstReason = null;
    int failed = 0;
    for (BulkResponseItem item : items) {
      if (item.error() == null) {
        continue;
      }
      failed++;
      if (firstReason == null) {
        firstReason = item.id() + ": " + item.error().type() + " " + item.error().reason();
      }
      allTransient &= isTransientStatus(item.status());
    }
    String message =
        failed + " of " + items.size() + " writes to " + getIndexName() + " failed, first "
            + firstReason;
    log.warn("[INDEX] {}", message);
    return allTransient
        ? IndexWriteException.transientFailure(getIndexName(), message, null)
        : IndexWriteException.permanentFailure(getIndexName(), message);
  }

  static boolean isTransientStatus(int status) {
    return status == 429 || status >= 500;
  }

  /** Executes a search and maps the hits, attaching scores to {@link ScoredDocument}s. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  protected List<T> executeSearch(SearchRequest request, String searchType) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", searchType, getIndexName(), hits.size());
      meterRegistry.counter(getMetricPrefix() + "." + searchType).increment();
      return mapHitsToDocuments(hits);
    } catch (IOException | ElasticsearchException e) {
      log.error("{} failed for {}: {}", searchType, getIndexName(), e.getMessage());
      throw new SearchException(searchType + " failed on " + getIndexName(), e);
    }
  }

  @Override
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      elasticsearchClient.deleteByQuery(request);
      log.info("Deleted documents from {} with criteria: {}", getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      throw IndexWriteException.transientFailure(
          getIndexName(), "Delete by " + criteria + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
