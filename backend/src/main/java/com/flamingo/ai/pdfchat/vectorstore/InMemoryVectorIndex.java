package com.flamingo.ai.pdfchat.vectorstore;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import com.flamingo.ai.pdfchat.service.rag.model.IndexStats;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Exact cosine search over vectors held in memory.
 *
 * <p>Entries are grouped per document so a store or delete replaces one map value atomically.
 * Searches see either all or none of a document's batch.
 */
@Service
@ConditionalOnProperty(
    name = "rag.vector-store.type",
    havingValue = "memory",
    matchIfMissing = true)
@Slf4j
public class InMemoryVectorIndex extends AbstractVectorIndex {

  private final Map<String, List<Entry>> documents = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  public InMemoryVectorIndex(RagConfig ragConfig) {
    super(ragConfig);
  }

  @Override
  public void store(List<DocumentChunk> chunks, List<float[]> vectors) {
    validateBatch(chunks, vectors);
    if (chunks.isEmpty()) {
      return;
    }

    Map<String, List<Entry>> byDocument = new LinkedHashMap<>();
    for (int i = 0; i < chunks.size(); i++) {
      DocumentChunk chunk = chunks.get(i);
      byDocument
          .computeIfAbsent(chunk.getDocumentId(), id -> new ArrayList<>())
          .add(new Entry(chunk, vectors.get(i).clone(), sequence.incrementAndGet()));
    }

    byDocument.forEach(
        (documentId, entries) ->
            documents.merge(
                documentId,
                List.copyOf(entries),
                (existing, added) -> {
                  List<Entry> merged = new ArrayList<>(existing);
                  merged.addAll(added);
                  return List.copyOf(merged);
                }));
    log.debug("Stored {} chunks in memory index", chunks.size());
  }

  @Override
  public List<RetrievedChunk> search(float[] queryVector, String documentFilter, int k) {
    validateVector(queryVector, "query vector");
    validateK(k);

    List<Candidate> candidates = new ArrayList<>();
    if (documentFilter != null) {
      score(documents.getOrDefault(documentFilter, List.of()), queryVector, candidates);
    } else {
      documents.values().forEach(entries -> score(entries, queryVector, candidates));
    }
    return rank(candidates, k);
  }

  @Override
  public DocumentStats stats(String documentId) {
    List<Entry> entries = documents.get(documentId);
    if (entries == null || entries.isEmpty()) {
      return DocumentStats.empty(documentId);
    }
    long pages = entries.stream().map(e -> e.chunk().getPageNumber()).distinct().count();
    return new DocumentStats(documentId, entries.size(), (int) pages);
  }

  @Override
  public IndexStats stats() {
    long total = documents.values().stream().mapToLong(List::size).sum();
    return new IndexStats(total, ragConfig.getVectorStore().getIndexName());
  }

  @Override
  public boolean delete(String documentId) {
    List<Entry> removed = documents.remove(documentId);
    if (removed == null) {
      return false;
    }
    log.debug("Deleted {} chunks for document {}", removed.size(), documentId);
    return !removed.isEmpty();
  }

  @Override
  public long clear() {
    long removed = 0;
    for (String documentId : List.copyOf(documents.keySet())) {
      List<Entry> entries = documents.remove(documentId);
      if (entries != null) {
        removed += entries.size();
      }
    }
    log.info("Cleared {} chunks from memory index", removed);
    return removed;
  }

  private static void score(List<Entry> entries, float[] query, List<Candidate> out) {
    for (Entry entry : entries) {
      out.add(
          new Candidate(entry.chunk(), cosineSimilarity(query, entry.vector()), entry.sequence()));
    }
  }

  private record Entry(DocumentChunk chunk, float[] vector, long sequence) {}
}
