package com.flamingo.ai.kbsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Vector index of one embedding model. Instances are created per configured model by {@link
 * VectorIndexRegistry}; the dense vector size is fixed at index creation.
 */
@Slf4j
public class ChunkVectorIndexService extends AbstractElasticsearchIndexService<ChunkVector> {

  private static final List<String> KEYWORD_FIELDS =
      List.of("documentId", "path", "contentHash", "area", "client", "docType", "category",
          "extension", "lot");

  // Upper bound on the points read back for one document; the search window default is 10000
  private static final int MAX_POINTS_PER_DOCUMENT = 10_000;

  private final String indexName;
  private final int vectorDimensions;

  public ChunkVectorIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  public int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    for (String field : KEYWORD_FIELDS) {
      properties.put(field, Property.of(p -> p.keyword(k -> k)));
    }
    properties.put("fileName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("subject", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("year", Property.of(p -> p.integer(i -> i)));
    properties.put("page", Property.of(p -> p.integer(i -> i)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ChunkVector chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId());
    document.put("path", chunk.getPath());
    document.put("fileName", chunk.getFileName());
    document.put("page", chunk.getPage());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("contentHash", chunk.getContentHash());
    document.put("text", chunk.getText());
    document.put("embedding", chunk.getEmbedding());
    document.put("extension", chunk.getExtension());
    if (chunk.getArea() != null) {
      document.put("area", chunk.getArea());
    }
    if (chunk.getYear() != null) {
      document.put("year", chunk.getYear());
    }
    if (chunk.getClient() != null) {
      document.put("client", chunk.getClient());
    }
    if (chunk.getSubject() != null) {
      document.put("subject", chunk.getSubject());
    }
    if (chunk.getDocType() != null) {
      document.put("docType", chunk.getDocType());
    }
    if (chunk.getCategory() != null) {
      document.put("category", chunk.getCategory());
    }
    if (chunk.getLot() != null) {
      document.put("lot", chunk.getLot());
    }
    return document;
  }

  @Override
  protected ChunkVector convertFromDocument(Map<String, Object> source) {
    Integer page = SearchFilterQueries.asInteger(source.get("page"));
    Integer chunkIndex = SearchFilterQueries.asInteger(source.get("chunkIndex"));
    return ChunkVector.builder()
        .id(SearchFilterQueries.asString(source.get("id")))
        .documentId(SearchFilterQueries.asString(source.get("documentId")))
        .path(SearchFilterQueries.asString(source.get("path")))
        .fileName(SearchFilterQueries.asString(source.get("fileName")))
        .page(page == null ? 1 : page)
        .chunkIndex(chunkIndex == null ? 0 : chunkIndex)
        .contentHash(SearchFilterQueries.asString(source.get("contentHash")))
        .text(SearchFilterQueries.asString(source.get("text")))
        .area(SearchFilterQueries.asString(source.get("area")))
        .year(SearchFilterQueries.asInteger(source.get("year")))
        .client(SearchFilterQueries.asString(source.get("client")))
        .subject(SearchFilterQueries.asString(source.get("subject")))
        .docType(SearchFilterQueries.asString(source.get("docType")))
        .category(SearchFilterQueries.asString(source.get("category")))
        .extension(SearchFilterQueries.asString(source.get("extension")))
        .lot(SearchFilterQueries.asString(source.get("lot")))
        .embedding(asVector(source.get("embedding")))
        .build();
  }

  private static List<Float> asVector(Object value) {
    if (!(value instanceof List<?> values)) {
      return null;
    }
    List<Float> vector = new ArrayList<>(values.size());
    for (Object component : values) {
      vector.add(((Number) component).floatValue());
    }
    return vector;
  }

  @Override
  protected String getDocumentId(ChunkVector entity) {
    return entity.getId();
  }

  /**
   * Supports two criteria: {@code contentHash} drops every point of that content, and {@code
   * documentId} with {@code keepContentHash} drops a document's points of any other content.
   */
  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object contentHash = criteria.get("contentHash");
    if (contentHash != null) {
      return Query.of(q -> q.term(t -> t.field("contentHash").value(contentHash.toString())));
    }
    Object documentId = criteria.get("documentId");
    Object keep = criteria.get("keepContentHash");
    if (documentId == null || keep == null) {
      throw new IllegalArgumentException(
          "deleteBy requires contentHash, or documentId with keepContentHash, in criteria");
    }
    return Query.of(
        q ->
            q.bool(
                b ->
                    b.filter(f -> f.term(t -> t.field("documentId").value(documentId.toString())))
                        .mustNot(m -> m.term(t -> t.field("contentHash").value(keep.toString())))));
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_vector";
  }

  /**
   * kNN search over the chunk embeddings, restricted by the structured filters.
   *
   * @throws com.flamingo.ai.kbsearch.exception.SearchException when the backend call fails
   */
  public List<ChunkVector> vectorSearch(
      Map<String, Object> filters, List<Float> queryEmbedding, int candidates) {
    List<Query> filterQueries = SearchFilterQueries.toFilterQueries(filters);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(candidates)
                                .numCandidates(candidates * 2)
                                .filter(filterQueries))
                    .source(src -> src.filter(f -> f.excludes("embedding")))
                    .size(candidates));
    return executeSearch(request, "vector_search");
  }

  /**
   * Returns the stored points of one document holding the given content, ordered by chunk index
   * and with their embeddings, or an empty list when no complete copy is visible yet.
   */
  public List<ChunkVector> findPointsOfContent(String contentHash) {
    Query byContent =
        Query.of(q -> q.term(t -> t.field("contentHash").value(contentHash)));
    List<ChunkVector> any =
        executeSearch(
            SearchRequest.of(
                s ->
                    s.index(indexName)
                        .query(byContent)
                        .source(src -> src.filter(f -> f.includes("documentId")))
                        .size(1)),
            "content_lookup");
    if (any.isEmpty() || any.get(0).getDocumentId() == null) {
      return List.of();
    }
    String documentId = any.get(0).getDocumentId();
    List<ChunkVector> points =
        executeSearch(
            SearchRequest.of(
                s ->
                    s.index(indexName)
                        .query(
                            q ->
                                q.bool(
                                    b ->
                                        b.filter(byContent)
                                            .filter(
                                                f ->
                                                    f.term(
                                                        t ->
                                                            t.field("documentId")
                                                                .value(documentId)))))
                        .sort(o -> o.field(f -> f.field("chunkIndex").order(SortOrder.Asc)))
                        .size(MAX_POINTS_PER_DOCUMENT)),
            "content_lookup");
    for (int i = 0; i < points.size(); i++) {
      ChunkVector point = points.get(i);
      if (point.getChunkIndex() != i || point.getEmbedding() == null) {
        log.debug("Stored copy of content {} in {} is incomplete", contentHash, indexName);
        return List.of();
      }
    }
    return points;
  }

  /** Drops the points of a document that hold content other than {@code currentContentHash}. */
  public void deleteStalePoints(String documentId, String currentContentHash) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("documentId", documentId);
    criteria.put("keepContentHash", currentContentHash);
    deleteBy(criteria);
  }

  /** Drops every point carrying the given content hash. */
  public void deleteByContentHash(String contentHash) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("contentHash", contentHash);
    deleteBy(criteria);
  }
}
