package com.flamingo.ai.pdfchat.service.pipeline;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.EmptyDocumentException;
import com.flamingo.ai.pdfchat.exception.ErrorCode;
import com.flamingo.ai.pdfchat.exception.PipelineException;
import com.flamingo.ai.pdfchat.exception.StorageException;
import com.flamingo.ai.pdfchat.exception.ValidationException;
import com.flamingo.ai.pdfchat.service.pipeline.dto.AnswerResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.AskRequest;
import com.flamingo.ai.pdfchat.service.pipeline.dto.ClearResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.SourceReference;
import com.flamingo.ai.pdfchat.service.pipeline.dto.SystemStatus;
import com.flamingo.ai.pdfchat.service.pipeline.dto.UploadResult;
import com.flamingo.ai.pdfchat.service.rag.RetrievalConfidenceService;
import com.flamingo.ai.pdfchat.service.rag.chunking.TextChunker;
import com.flamingo.ai.pdfchat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.pdfchat.service.rag.extraction.TextExtractorRouter;
import com.flamingo.ai.pdfchat.service.rag.generation.AnswerGenerationService;
import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import com.flamingo.ai.pdfchat.service.rag.model.IndexStats;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import com.flamingo.ai.pdfchat.vectorstore.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Implementation of the RagPipelineService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RagPipelineServiceImpl implements RagPipelineService {

  static final String NO_INFORMATION_ANSWER =
      "I couldn't find relevant information in the documents to answer your question. "
          + "Please try rephrasing your question or upload a relevant document.";

  static final String ERROR_ANSWER =
      "I'm sorry, I encountered an error while processing your question. Please try again.";

  private final TextExtractorRouter textExtractorRouter;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final AnswerGenerationService answerGenerationService;
  private final RetrievalConfidenceService retrievalConfidenceService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.ingest", description = "Time to ingest a document")
  public UploadResult uploadDocument(byte[] bytes, String filename) {
    log.info("Ingesting document {}", filename);
    String documentId = null;
    int chunkCount = 0;

    try {
      validateUpload(bytes, filename);
      documentId = UUID.randomUUID().toString();

      String text = textExtractorRouter.extract(bytes, filename);
      List<DocumentChunk> chunks = textChunker.chunkDocument(text, documentId, filename);
      if (chunks.isEmpty()) {
        throw new EmptyDocumentException(filename);
      }
      chunkCount = chunks.size();

      List<float[]> vectors =
          embeddingService.embedBatch(chunks.stream().map(DocumentChunk::getContent).toList());
      vectorIndex.store(chunks, vectors);

      int pageCount =
          (int) chunks.stream().mapToInt(DocumentChunk::getPageNumber).distinct().count();
      meterRegistry.counter("rag.ingest.success").increment();
      log.info(
          "Document {} ingested as {}: {} pages, {} chunks",
          filename,
          documentId,
          pageCount,
          chunkCount);
      return UploadResult.success(documentId, filename, pageCount, chunkCount);

    } catch (StorageException e) {
      log.error("Failed to store document {} ({}): {}", filename, documentId, e.getMessage());
      meterRegistry.counter("rag.ingest.failure", "code", e.getErrorCode().name()).increment();
      UploadResult result = UploadResult.failure(e.getErrorCode(), e.getUserMessage(), filename);
      result.setDocumentId(documentId);
      result.setChunksCreated(chunkCount);
      return result;
    } catch (PipelineException e) {
      log.warn("Ingest of {} rejected: {}", filename, e.getMessage());
      meterRegistry.counter("rag.ingest.failure", "code", e.getErrorCode().name()).increment();
      return UploadResult.failure(e.getErrorCode(), e.getUserMessage(), filename);
    } catch (RuntimeException e) {
      log.error("Unexpected error ingesting {}: {}", filename, e.getMessage(), e);
      meterRegistry
          .counter("rag.ingest.failure", "code", ErrorCode.INTERNAL_ERROR.name())
          .increment();
      return UploadResult.failure(
          ErrorCode.INTERNAL_ERROR, "Error processing document: " + e.getMessage(), filename);
    }
  }

  private void validateUpload(byte[] bytes, String filename) {
    if (filename == null || filename.isBlank()) {
      throw new ValidationException("Filename is required");
    }
    if (bytes == null || bytes.length == 0) {
      throw new ValidationException("Uploaded file is empty");
    }
    long maxBytes = ragConfig.getUpload().getMaxFileSizeBytes();
    if (bytes.length > maxBytes) {
      throw new ValidationException(
          String.format("File size exceeds the maximum of %d MB", maxBytes / (1024 * 1024)));
    }
    if (!textExtractorRouter.supports(filename)) {
      throw new ValidationException("Unsupported file type: " + filename);
    }
  }

  @Override
  public AnswerResult ask(AskRequest request) {
    return ask(
        request.getMessage(),
        request.getDocumentId(),
        request.getHistory(),
        request.getTemperature(),
        request.getMaxTokens());
  }

  @Override
  public AnswerResult ask(
      String query, String documentId, List<ChatTurn> history, double temperature, int maxTokens) {
    // timed explicitly, ask(AskRequest) and askAsync reach this through self-calls
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return answer(query, documentId, history, temperature, maxTokens);
    } finally {
      sample.stop(
          Timer.builder("rag.query")
              .description("Time to answer a question")
              .register(meterRegistry));
    }
  }

  private AnswerResult answer(
      String query, String documentId, List<ChatTurn> history, double temperature, int maxTokens) {
    long start = System.nanoTime();
    try {
      validateQuery(query, temperature, maxTokens);
      log.debug("Answering query ({} chars), document filter: {}", query.length(), documentId);

      float[] queryVector = embeddingService.embed(query);
      List<RetrievedChunk> chunks = retrieve(queryVector, documentId);

      if (chunks.isEmpty()) {
        meterRegistry.counter("rag.query.no_results").increment();
        return AnswerResult.builder()
            .success(true)
            .response(NO_INFORMATION_ANSWER)
            .confidence(0.0)
            .processingTime(elapsedSeconds(start))
            .build();
      }

      String answer =
          answerGenerationService.generate(query, chunks, history, temperature, maxTokens);

      AnswerResult result =
          AnswerResult.builder()
              .success(true)
              .response(answer)
              .sources(retrievalConfidenceService.formatSources(chunks))
              .sourceReferences(chunks.stream().map(RagPipelineServiceImpl::toReference).toList())
              .confidence(retrievalConfidenceService.calculateConfidence(chunks))
              .processingTime(elapsedSeconds(start))
              .build();
      meterRegistry.counter("rag.query.success").increment();
      log.info(
          "Answered query with {} sources, confidence {} in {}s",
          chunks.size(),
          result.getConfidence(),
          result.getProcessingTime());
      return result;

    } catch (ValidationException e) {
      log.debug("Query rejected: {}", e.getMessage());
      meterRegistry.counter("rag.query.failure", "code", e.getErrorCode().name()).increment();
      return AnswerResult.failure(e.getErrorCode(), e.getUserMessage(), elapsedSeconds(start));
    } catch (PipelineException e) {
      log.error("Query failed: {}", e.getMessage());
      meterRegistry.counter("rag.query.failure", "code", e.getErrorCode().name()).increment();
      return AnswerResult.failure(e.getErrorCode(), ERROR_ANSWER, elapsedSeconds(start));
    } catch (RuntimeException e) {
      log.error("Unexpected error answering query: {}", e.getMessage(), e);
      meterRegistry
          .counter("rag.query.failure", "code", ErrorCode.INTERNAL_ERROR.name())
          .increment();
      return AnswerResult.failure(ErrorCode.INTERNAL_ERROR, ERROR_ANSWER, elapsedSeconds(start));
    }
  }

  private void validateQuery(String query, double temperature, int maxTokens) {
    RagConfig.Query limits = ragConfig.getQuery();
    if (query == null || query.isBlank()) {
      throw new ValidationException("Message cannot be empty");
    }
    if (query.length() > limits.getMaxLength()) {
      throw new ValidationException(
          "Message too long (max " + limits.getMaxLength() + " characters)");
    }
    if (temperature < limits.getMinTemperature() || temperature > limits.getMaxTemperature()) {
      throw new ValidationException(
          String.format(
              "Temperature must be between %s and %s",
              limits.getMinTemperature(), limits.getMaxTemperature()));
    }
    if (maxTokens < limits.getMinMaxTokens() || maxTokens > limits.getMaxMaxTokens()) {
      throw new ValidationException(
          String.format(
              "Max tokens must be between %d and %d",
              limits.getMinMaxTokens(), limits.getMaxMaxTokens()));
    }
  }

  /** Filtered search, widened once to all documents when the filter finds nothing. */
  private List<RetrievedChunk> retrieve(float[] queryVector, String documentId) {
    int topK = ragConfig.getRetrieval().getTopK();
    String filter = documentId == null || documentId.isBlank() ? null : documentId;

    List<RetrievedChunk> chunks = search(queryVector, filter, topK);
    if (chunks.isEmpty() && filter != null) {
      log.info("No results in document {}, searching all documents", filter);
      meterRegistry.counter("rag.query.filter_widened").increment();
      chunks = search(queryVector, null, topK);
    }
    return chunks;
  }

  private List<RetrievedChunk> search(float[] queryVector, String filter, int topK) {
    try {
      return vectorIndex.search(queryVector, filter, topK);
    } catch (StorageException e) {
      log.warn("Vector search failed, continuing without results: {}", e.getMessage());
      return List.of();
    }
  }

  @Override
  @Timed(value = "rag.delete", description = "Time to delete a document")
  public boolean deleteDocument(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      return false;
    }
    try {
      boolean deleted = vectorIndex.delete(documentId);
      if (deleted) {
        meterRegistry.counter("rag.document.deleted").increment();
        log.info("Deleted document {}", documentId);
      } else {
        log.debug("Document {} not found for deletion", documentId);
      }
      return deleted;
    } catch (PipelineException e) {
      log.error("Failed to delete document {}: {}", documentId, e.getMessage());
      return false;
    }
  }

  @Override
  @Timed(value = "rag.clear", description = "Time to remove every document")
  public ClearResult clearDocuments() {
    try {
      long removed = vectorIndex.clear();
      meterRegistry.counter("rag.document.cleared").increment();
      log.info("Cleared all documents, {} chunks removed", removed);
      return ClearResult.success(removed);
    } catch (PipelineException e) {
      log.error("Failed to clear documents: {}", e.getMessage());
      return ClearResult.failure(e.getErrorCode(), "Failed to clear documents");
    } catch (RuntimeException e) {
      log.error("Unexpected error clearing documents: {}", e.getMessage(), e);
      return ClearResult.failure(
          ErrorCode.INTERNAL_ERROR, "Error clearing documents: " + e.getMessage());
    }
  }

  @Override
  public DocumentStats documentStats(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      return DocumentStats.empty(documentId);
    }
    try {
      return vectorIndex.stats(documentId);
    } catch (StorageException e) {
      log.warn("Could not read stats for document {}: {}", documentId, e.getMessage());
      return DocumentStats.empty(documentId);
    }
  }

  @Override
  public SystemStatus status() {
    SystemStatus.SystemStatusBuilder status =
        SystemStatus.builder()
            .vectorStoreType(ragConfig.getVectorStore().getType())
            .indexName(ragConfig.getVectorStore().getIndexName())
            .embeddingModel(embeddingService.describeModel())
            .embeddingDimension(embeddingService.dimension())
            .availableGenerationBackends(answerGenerationService.availableBackends())
            .chunkSize(ragConfig.getChunking().getSize())
            .chunkOverlap(ragConfig.getChunking().getOverlap())
            .topK(ragConfig.getRetrieval().getTopK())
            .similarityThreshold(ragConfig.getRetrieval().getSimilarityThreshold())
            .timestamp(LocalDateTime.now());
    try {
      IndexStats stats = vectorIndex.stats();
      return status.healthy(true).totalChunks(stats.totalChunkCount()).build();
    } catch (PipelineException e) {
      log.warn("Vector index unavailable for status: {}", e.getMessage());
      return status.healthy(false).error(e.getMessage()).build();
    }
  }

  @Override
  @Async("ragExecutor")
  public CompletableFuture<UploadResult> uploadDocumentAsync(byte[] bytes, String filename) {
    return CompletableFuture.completedFuture(uploadDocument(bytes, filename));
  }

  @Override
  @Async("ragExecutor")
  public CompletableFuture<AnswerResult> askAsync(AskRequest request) {
    return CompletableFuture.completedFuture(ask(request));
  }

  private static SourceReference toReference(RetrievedChunk chunk) {
    return new SourceReference(
        chunk.chunk().getDocumentId(),
        chunk.fileName(),
        chunk.pageNumber(),
        chunk.similarity(),
        chunk.rank());
  }

  private static double elapsedSeconds(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000_000.0;
  }
}
