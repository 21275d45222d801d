package com.flamingo.ai.pdfchat.vectorstore;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.PipelineException;
import com.flamingo.ai.pdfchat.exception.StorageException;
import com.flamingo.ai.pdfchat.service.rag.BackendCallExecutor;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import com.flamingo.ai.pdfchat.service.rag.model.IndexStats;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Vector index backed by an Elasticsearch {@code dense_vector} field with cosine similarity.
 *
 * <p>Writes use {@code refresh=wait_for} so stored chunks are searchable as soon as {@link #store}
 * returns. A failed bulk write is rolled back with a delete-by-query on the document ids of the
 * batch before {@link StorageException} is raised, so a batch must carry whole documents under
 * ids that hold nothing else. The pipeline mints a fresh id per upload.
 *
 * <p>A bulk request cancelled by its timeout may still be applied by the cluster after the
 * rollback ran. Such late chunks stay in the index until their document is deleted.
 */
@Service
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchVectorIndex extends AbstractVectorIndex {

  static final String FIELD_DOCUMENT_ID = "documentId";
  static final String FIELD_FILE_NAME = "fileName";
  static final String FIELD_CONTENT = "content";
  static final String FIELD_PAGE_NUMBER = "pageNumber";
  static final String FIELD_CHUNK_INDEX = "chunkIndex";
  static final String FIELD_SEQUENCE = "sequence";
  static final String FIELD_EMBEDDING = "embedding";

  private static final int MAX_PAGE_BUCKETS = 10_000;

  private final ElasticsearchClient elasticsearchClient;
  private final BackendCallExecutor backendCallExecutor;
  private final MeterRegistry meterRegistry;

  // Seeded from the clock so insertion order survives restarts
  private final AtomicLong sequence = new AtomicLong(System.currentTimeMillis() * 1000);

  public ElasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      BackendCallExecutor backendCallExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    super(ragConfig);
    this.elasticsearchClient = elasticsearchClient;
    this.backendCallExecutor = backendCallExecutor;
    this.meterRegistry = meterRegistry;
  }

  public String getIndexName() {
    return ragConfig.getVectorStore().getIndexName();
  }

  @PostConstruct
  public void initIndex() {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        elasticsearchClient
            .indices()
            .create(
                c ->
                    c.index(getIndexName())
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        log.debug("Elasticsearch index '{}' already exists", getIndexName());
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // documentId must be keyword for exact-match filtering
    properties.put(FIELD_DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_FILE_NAME, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_CONTENT, Property.of(p -> p.text(t -> t)));
    properties.put(FIELD_PAGE_NUMBER, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_CHUNK_INDEX, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_SEQUENCE, Property.of(p -> p.long_(l -> l)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimensions())
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "vectorstore.store", description = "Time to store chunk vectors")
  public void store(List<DocumentChunk> chunks, List<float[]> vectors) {
    validateBatch(chunks, vectors);
    if (chunks.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulk = new BulkRequest.Builder().refresh(Refresh.WaitFor);
    for (int i = 0; i < chunks.size(); i++) {
      DocumentChunk chunk = chunks.get(i);
      Map<String, Object> source = toSource(chunk, vectors.get(i), sequence.incrementAndGet());
      bulk.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(chunk.getId()).document(source)));
    }
    BulkRequest request = bulk.build();

    BulkResponse response;
    try {
      response = execute("store", () -> elasticsearchClient.bulk(request));
    } catch (StorageException e) {
      rollback(chunks);
      throw e;
    }

    if (response.errors()) {
      int failed = 0;
      String firstError = null;
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          failed++;
          if (firstError == null) {
            firstError = item.error().reason();
          }
        }
      }
      meterRegistry.counter("vectorstore.store.errors").increment();
      rollback(chunks);
      throw new StorageException(
          String.format(
              "Bulk write to %s failed for %d of %d chunks: %s",
              getIndexName(), failed, chunks.size(), firstError));
    }

    meterRegistry.counter("vectorstore.stored").increment(chunks.size());
    log.debug("Indexed {} chunks to {}", chunks.size(), getIndexName());
  }

  private void rollback(List<DocumentChunk> chunks) {
    List<FieldValue> documentIds =
        chunks.stream().map(DocumentChunk::getDocumentId).distinct().map(FieldValue::of).toList();
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(
            d ->
                d.index(getIndexName())
                    .query(
                        q ->
                            q.terms(
                                t -> t.field(FIELD_DOCUMENT_ID).terms(v -> v.value(documentIds))))
                    .conflicts(Conflicts.Proceed)
                    .refresh(true));
    try {
      Long deleted =
          execute("rollback", () -> elasticsearchClient.deleteByQuery(request).deleted());
      log.info(
          "Rolled back {} chunks of documents {} in {}",
          deleted != null ? deleted : 0,
          documentIds.stream().map(FieldValue::stringValue).toList(),
          getIndexName());
    } catch (StorageException e) {
      log.error(
          "Rollback of {} chunks in {} failed, index may hold orphans: {}",
          chunks.size(),
          getIndexName(),
          e.getMessage());
    }
  }

  @Override
  @Timed(value = "vectorstore.search", description = "Time for vector search")
  public List<RetrievedChunk> search(float[] queryVector, String documentFilter, int k) {
    validateVector(queryVector, "query vector");
    validateK(k);

    List<Float> vector = new ArrayList<>(queryVector.length);
    for (float v : queryVector) {
      vector.add(v);
    }
    int numCandidates = Math.max(k * 10, 100);

    SearchResponse<Map> response =
        execute(
            "search",
            () ->
                elasticsearchClient.search(
                    s ->
                        s.index(getIndexName())
                            .size(k)
                            .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING)))
                            .knn(
                                knn -> {
                                  knn.field(FIELD_EMBEDDING)
                                      .queryVector(vector)
                                      .k(k)
                                      .numCandidates(numCandidates);
                                  if (documentFilter != null) {
                                    knn.filter(documentQuery(documentFilter));
                                  }
                                  return knn;
                                }),
                    Map.class));

    List<Candidate> candidates = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      Map<String, Object> source = hit.source();
      if (source == null || hit.score() == null) {
        continue;
      }
      candidates.add(
          new Candidate(
              fromSource(hit.id(), source),
              toSimilarity(hit.score()),
              asLong(source.get(FIELD_SEQUENCE))));
    }

    List<RetrievedChunk> ranked = rank(candidates, k);
    meterRegistry.counter("vectorstore.search").increment();
    log.debug(
        "kNN search on {} (filter={}) returned {} hits, {} above threshold",
        getIndexName(),
        documentFilter,
        candidates.size(),
        ranked.size());
    return ranked;
  }

  @Override
  public DocumentStats stats(String documentId) {
    SearchResponse<Void> response =
        execute(
            "stats",
            () ->
                elasticsearchClient.search(
                    s ->
                        s.index(getIndexName())
                            .size(0)
                            .trackTotalHits(t -> t.enabled(true))
                            .query(documentQuery(documentId))
                            .aggregations(
                                "pages",
                                a ->
                                    a.terms(
                                        t -> t.field(FIELD_PAGE_NUMBER).size(MAX_PAGE_BUCKETS))),
                    Void.class));

    long chunkCount = response.hits().total() != null ? response.hits().total().value() : 0;
    if (chunkCount == 0) {
      return DocumentStats.empty(documentId);
    }
    int pages = response.aggregations().get("pages").lterms().buckets().array().size();
    return new DocumentStats(documentId, (int) chunkCount, pages);
  }

  @Override
  public IndexStats stats() {
    long total =
        execute("count", () -> elasticsearchClient.count(c -> c.index(getIndexName())).count());
    return new IndexStats(total, getIndexName());
  }

  @Override
  @Timed(value = "vectorstore.delete", description = "Time to delete a document's chunks")
  public boolean delete(String documentId) {
    DeleteByQueryResponse response =
        execute(
            "delete",
            () ->
                elasticsearchClient.deleteByQuery(
                    d ->
                        d.index(getIndexName())
                            .query(documentQuery(documentId))
                            .refresh(true)));
    long deleted = response.deleted() != null ? response.deleted() : 0;
    log.info("Deleted {} chunks of document {} from {}", deleted, documentId, getIndexName());
    return deleted > 0;
  }

  @Override
  @Timed(value = "vectorstore.clear", description = "Time to remove every chunk")
  public long clear() {
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(
            d ->
                d.index(getIndexName())
                    .query(q -> q.matchAll(m -> m))
                    .conflicts(Conflicts.Proceed)
                    .refresh(true));
    DeleteByQueryResponse response =
        execute("clear", () -> elasticsearchClient.deleteByQuery(request));
    long deleted = response.deleted() != null ? response.deleted() : 0;
    log.info("Cleared {} chunks from {}", deleted, getIndexName());
    return deleted;
  }

  private <T> T execute(String operation, Callable<T> call) {
    try {
      return backendCallExecutor.call(
          "vectorstore-" + operation, ragConfig.getVectorStore().getTimeout(), call);
    } catch (PipelineException e) {
      throw e;
    } catch (Exception e) {
      log.error("Vector store {} failed on {}: {}", operation, getIndexName(), e.getMessage());
      meterRegistry.counter("vectorstore.failures", "operation", operation).increment();
      throw new StorageException(
          "Vector store " + operation + " failed: " + e.getMessage(), e);
    }
  }

  private static Query documentQuery(String documentId) {
    return Query.of(q -> q.term(t -> t.field(FIELD_DOCUMENT_ID).value(documentId)));
  }

  /** Converts an Elasticsearch cosine score {@code (1 + cos) / 2} back to {@code cos}. */
  @VisibleForTesting
  static double toSimilarity(double score) {
    return 2.0 * score - 1.0;
  }

  @VisibleForTesting
  static Map<String, Object> toSource(DocumentChunk chunk, float[] vector, long sequence) {
    Map<String, Object> source = new HashMap<>();
    source.put(FIELD_DOCUMENT_ID, chunk.getDocumentId());
    source.put(FIELD_FILE_NAME, chunk.getFileName());
    source.put(FIELD_CONTENT, chunk.getContent());
    source.put(FIELD_PAGE_NUMBER, chunk.getPageNumber());
    source.put(FIELD_CHUNK_INDEX, chunk.getChunkIndex());
    source.put(FIELD_SEQUENCE, sequence);
    source.put(FIELD_EMBEDDING, vector);
    return source;
  }

  @VisibleForTesting
  static DocumentChunk fromSource(String id, Map<String, Object> source) {
    String content = String.valueOf(source.getOrDefault(FIELD_CONTENT, ""));
    int pageNumber = (int) asLong(source.get(FIELD_PAGE_NUMBER));
    Map<String, Object> metadata = new HashMap<>();
    Object fileName = source.get(FIELD_FILE_NAME);
    if (fileName != null) {
      metadata.put(DocumentChunk.META_FILENAME, fileName.toString());
    }
    metadata.put(DocumentChunk.META_CHUNK_LENGTH, content.length());
    metadata.put(DocumentChunk.META_PAGE_NUMBER, pageNumber);
    return DocumentChunk.builder()
        .id(id)
        .documentId(String.valueOf(source.get(FIELD_DOCUMENT_ID)))
        .content(content)
        .pageNumber(pageNumber)
        .chunkIndex((int) asLong(source.get(FIELD_CHUNK_INDEX)))
        .metadata(Map.copyOf(metadata))
        .build();
  }

  private static long asLong(Object value) {
    return value instanceof Number n ? n.longValue() : 0L;
  }
}
