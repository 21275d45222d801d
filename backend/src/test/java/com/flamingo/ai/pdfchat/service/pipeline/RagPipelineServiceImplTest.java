package com.flamingo.ai.pdfchat.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.DocumentProcessingException;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import com.flamingo.ai.pdfchat.exception.ErrorCode;
import com.flamingo.ai.pdfchat.exception.StorageException;
import com.flamingo.ai.pdfchat.service.pipeline.dto.AnswerResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.AskRequest;
import com.flamingo.ai.pdfchat.service.pipeline.dto.ClearResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.SystemStatus;
import com.flamingo.ai.pdfchat.service.pipeline.dto.UploadResult;
import com.flamingo.ai.pdfchat.service.rag.RetrievalConfidenceService;
import com.flamingo.ai.pdfchat.service.rag.chunking.TextChunker;
import com.flamingo.ai.pdfchat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.pdfchat.service.rag.extraction.TextExtractorRouter;
import com.flamingo.ai.pdfchat.service.rag.generation.AnswerGenerationService;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import com.flamingo.ai.pdfchat.service.rag.model.IndexStats;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import com.flamingo.ai.pdfchat.vectorstore.VectorIndex;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
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
@DisplayName("RagPipelineServiceImpl Tests")
class RagPipelineServiceImplTest {

  private static final byte[] BYTES = "some content".getBytes(StandardCharsets.UTF_8);
  private static final float[] QUERY_VECTOR = {0.1f, 0.2f, 0.3f};

  @Mock private TextExtractorRouter textExtractorRouter;
  @Mock private TextChunker textChunker;
  @Mock private EmbeddingService embeddingService;
  @Mock private VectorIndex vectorIndex;
  @Mock private AnswerGenerationService answerGenerationService;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private RagPipelineServiceImpl pipeline;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    pipeline =
        new RagPipelineServiceImpl(
            textExtractorRouter,
            textChunker,
            embeddingService,
            vectorIndex,
            answerGenerationService,
            new RetrievalConfidenceService(meterRegistry),
            ragConfig,
            meterRegistry);
  }

  private static DocumentChunk chunk(String documentId, int index, int page) {
    return DocumentChunk.builder()
        .id(DocumentChunk.chunkId(documentId, index))
        .documentId(documentId)
        .content("Chunk " + index + " of the employee handbook with enough text.")
        .pageNumber(page)
        .chunkIndex(index)
        .metadata(Map.of(DocumentChunk.META_FILENAME, "handbook.pdf"))
        .build();
  }

  private static RetrievedChunk retrieved(int rank, double similarity) {
    return new RetrievedChunk(chunk("doc-1", rank - 1, rank), similarity, rank);
  }

  @Nested
  @DisplayName("Upload")
  class Upload {

    @Test
    @DisplayName("Should extract, chunk, embed and store a document")
    void shouldIngestDocument() {
      when(textExtractorRouter.supports("handbook.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "handbook.pdf")).thenReturn("text");
      when(textChunker.chunkDocument(eq("text"), anyString(), eq("handbook.pdf")))
          .thenAnswer(
              invocation -> {
                String id = invocation.getArgument(1);
                return List.of(chunk(id, 0, 1), chunk(id, 1, 2));
              });
      when(embeddingService.embedBatch(anyList()))
          .thenReturn(List.of(new float[] {1f, 0f, 0f}, new float[] {0f, 1f, 0f}));

      UploadResult result = pipeline.uploadDocument(BYTES, "handbook.pdf");

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getDocumentId()).isNotBlank();
      assertThat(result.getChunksCreated()).isEqualTo(2);
      assertThat(result.getPagesProcessed()).isEqualTo(2);
      verify(vectorIndex).store(anyList(), anyList());
      assertThat(meterRegistry.counter("rag.ingest.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count pages and chunks from the stored batch without reading the index")
    void shouldReportCountsWithoutReadingIndex() {
      when(textExtractorRouter.supports("handbook.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "handbook.pdf")).thenReturn("text");
      when(textChunker.chunkDocument(eq("text"), anyString(), eq("handbook.pdf")))
          .thenAnswer(
              invocation -> {
                String id = invocation.getArgument(1);
                return List.of(chunk(id, 0, 1), chunk(id, 1, 2), chunk(id, 2, 2));
              });
      when(embeddingService.embedBatch(anyList()))
          .thenReturn(
              List.of(
                  new float[] {1f, 0f, 0f}, new float[] {0f, 1f, 0f}, new float[] {0f, 0f, 1f}));
      lenient()
          .when(vectorIndex.stats(anyString()))
          .thenThrow(new StorageException("stats timed out"));

      UploadResult result = pipeline.uploadDocument(BYTES, "handbook.pdf");

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getErrorCode()).isNull();
      assertThat(result.getChunksCreated()).isEqualTo(3);
      assertThat(result.getPagesProcessed()).isEqualTo(2);
      verify(vectorIndex, never()).stats(anyString());
      verify(vectorIndex, never()).delete(anyString());
    }

    @Test
    @DisplayName("Should reject empty bytes without extracting")
    void shouldRejectEmptyBytes() {
      UploadResult result = pipeline.uploadDocument(new byte[0], "handbook.pdf");

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
      assertThat(result.getMessage()).isEqualTo("Uploaded file is empty");
      verifyNoInteractions(textExtractorRouter, vectorIndex);
    }

    @Test
    @DisplayName("Should reject files above the size limit")
    void shouldRejectLargeFiles() {
      ragConfig.getUpload().setMaxFileSizeBytes(4);

      UploadResult result = pipeline.uploadDocument(BYTES, "handbook.pdf");

      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
      assertThat(result.getMessage()).startsWith("File size exceeds");
    }

    @Test
    @DisplayName("Should reject unsupported file types")
    void shouldRejectUnsupportedType() {
      when(textExtractorRouter.supports("photo.png")).thenReturn(false);

      UploadResult result = pipeline.uploadDocument(BYTES, "photo.png");

      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
      assertThat(result.getMessage()).contains("Unsupported file type");
    }

    @Test
    @DisplayName("Should report a document without usable text as empty")
    void shouldReportEmptyDocument() {
      when(textExtractorRouter.supports("scan.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "scan.pdf")).thenReturn("");
      when(textChunker.chunkDocument(eq(""), anyString(), eq("scan.pdf"))).thenReturn(List.of());

      UploadResult result = pipeline.uploadDocument(BYTES, "scan.pdf");

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.EMPTY_DOCUMENT);
      verifyNoInteractions(embeddingService, vectorIndex);
    }

    @Test
    @DisplayName("Should report extraction failures")
    void shouldReportExtractionFailure() {
      when(textExtractorRouter.supports("broken.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "broken.pdf"))
          .thenThrow(new DocumentProcessingException(
                  "broken.pdf", "bad xref", new IOException("bad xref")));

      UploadResult result = pipeline.uploadDocument(BYTES, "broken.pdf");

      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.EXTRACTION_FAILED);
    }

    @Test
    @DisplayName("Should report embedding outages without storing")
    void shouldReportEmbeddingOutage() {
      when(textExtractorRouter.supports("handbook.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "handbook.pdf")).thenReturn("text");
      when(textChunker.chunkDocument(eq("text"), anyString(), eq("handbook.pdf")))
          .thenReturn(List.of(chunk("x", 0, 1)));
      when(embeddingService.embedBatch(anyList()))
          .thenThrow(new EmbeddingUnavailableException("model down"));

      UploadResult result = pipeline.uploadDocument(BYTES, "handbook.pdf");

      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.EMBEDDING_UNAVAILABLE);
      verify(vectorIndex, never()).store(anyList(), anyList());
    }

    @Test
    @DisplayName("Should report storage failures with the document id and chunk count")
    void shouldReportStorageFailure() {
      when(textExtractorRouter.supports("handbook.pdf")).thenReturn(true);
      when(textExtractorRouter.extract(BYTES, "handbook.pdf")).thenReturn("text");
      when(textChunker.chunkDocument(eq("text"), anyString(), eq("handbook.pdf")))
          .thenReturn(List.of(chunk("x", 0, 1)));
      when(embeddingService.embedBatch(anyList())).thenReturn(List.of(new float[] {1f, 0f, 0f}));
      doThrow(new StorageException("bulk rejected")).when(vectorIndex).store(anyList(), anyList());

      UploadResult result = pipeline.uploadDocument(BYTES, "handbook.pdf");

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.STORAGE_FAILURE);
      assertThat(result.getDocumentId()).isNotBlank();
      assertThat(result.getChunksCreated()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Ask")
  class Ask {

    @Test
    @DisplayName("Should answer with sources and confidence")
    void shouldAnswer() {
      List<RetrievedChunk> chunks = List.of(retrieved(1, 0.9), retrieved(2, 0.7));
      when(embeddingService.embed("What is the leave policy?")).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(QUERY_VECTOR, null, 5)).thenReturn(chunks);
      when(answerGenerationService.generate(
              eq("What is the leave policy?"), eq(chunks), anyList(), eq(0.7), eq(500)))
          .thenReturn("Employees get 25 days of leave.");

      AnswerResult result =
          pipeline.ask(AskRequest.builder().message("What is the leave policy?").build());

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getResponse()).isEqualTo("Employees get 25 days of leave.");
      assertThat(result.getSources())
          .containsExactly(
              "handbook.pdf (Page 1, Similarity: 0.90)", "handbook.pdf (Page 2, Similarity: 0.70)");
      assertThat(result.getSourceReferences()).hasSize(2);
      assertThat(result.getSourceReferences().get(0).rank()).isEqualTo(1);
      assertThat(result.getConfidence()).isEqualTo(0.8);
      assertThat(result.getProcessingTime()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    @DisplayName("Should record the query timer once per question")
    void shouldRecordQueryTimer() {
      when(embeddingService.embed(anyString())).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(any(float[].class), isNull(), anyInt())).thenReturn(List.of());

      pipeline.ask(AskRequest.builder().message("Anything on leave?").build());
      pipeline.ask("Anything on pay?", null, List.of(), 0.7, 500);

      assertThat(meterRegistry.get("rag.query").timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should widen a document filter that finds nothing")
    void shouldWidenEmptyFilter() {
      List<RetrievedChunk> chunks = List.of(retrieved(1, 0.6));
      when(embeddingService.embed(anyString())).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(QUERY_VECTOR, "doc-2", 5)).thenReturn(List.of());
      when(vectorIndex.search(QUERY_VECTOR, null, 5)).thenReturn(chunks);
      when(answerGenerationService.generate(
              anyString(), eq(chunks), anyList(), anyDouble(), anyInt()))
          .thenReturn("From the other document.");

      AnswerResult result =
          pipeline.ask(
              AskRequest.builder().message("Anything on leave?").documentId("doc-2").build());

      assertThat(result.getResponse()).isEqualTo("From the other document.");
      assertThat(meterRegistry.counter("rag.query.filter_widened").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return the no-information answer without generating")
    void shouldReturnNoInformationAnswer() {
      when(embeddingService.embed(anyString())).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(any(float[].class), isNull(), anyInt())).thenReturn(List.of());

      AnswerResult result = pipeline.ask(AskRequest.builder().message("Unrelated?").build());

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getResponse()).isEqualTo(RagPipelineServiceImpl.NO_INFORMATION_ANSWER);
      assertThat(result.getSources()).isEmpty();
      assertThat(result.getConfidence()).isZero();
      verifyNoInteractions(answerGenerationService);
    }

    @Test
    @DisplayName("Should treat a failing search as no results")
    void shouldTreatSearchFailureAsNoResults() {
      when(embeddingService.embed(anyString())).thenReturn(QUERY_VECTOR);
      when(vectorIndex.search(any(float[].class), isNull(), anyInt()))
          .thenThrow(new StorageException("cluster red"));

      AnswerResult result = pipeline.ask(AskRequest.builder().message("Anything?").build());

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getResponse()).isEqualTo(RagPipelineServiceImpl.NO_INFORMATION_ANSWER);
    }

    @Test
    @DisplayName("Should reject blank and overlong questions")
    void shouldRejectInvalidQuestions() {
      AnswerResult blank = pipeline.ask(AskRequest.builder().message("  ").build());
      AnswerResult overlong = pipeline.ask(AskRequest.builder().message("x".repeat(1001)).build());

      assertThat(blank.isSuccess()).isFalse();
      assertThat(blank.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
      assertThat(blank.getResponse()).isEqualTo("Message cannot be empty");
      assertThat(overlong.getResponse()).contains("Message too long");
      verifyNoInteractions(embeddingService);
    }

    @Test
    @DisplayName("Should reject out-of-range generation parameters")
    void shouldRejectOutOfRangeParameters() {
      AnswerResult hot =
          pipeline.ask(AskRequest.builder().message("Hi there").temperature(1.5).build());
      AnswerResult tiny =
          pipeline.ask(AskRequest.builder().message("Hi there").maxTokens(10).build());

      assertThat(hot.getResponse()).startsWith("Temperature must be between");
      assertThat(tiny.getResponse()).isEqualTo("Max tokens must be between 50 and 2000");
    }

    @Test
    @DisplayName("Should return the generic error answer when embedding is down")
    void shouldReturnErrorAnswerOnEmbeddingFailure() {
      when(embeddingService.embed(anyString()))
          .thenThrow(new EmbeddingUnavailableException("model down"));

      AnswerResult result = pipeline.ask(AskRequest.builder().message("Anything?").build());

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.EMBEDDING_UNAVAILABLE);
      assertThat(result.getResponse()).isEqualTo(RagPipelineServiceImpl.ERROR_ANSWER);
    }
  }

  @Nested
  @DisplayName("Delete, stats and status")
  class Management {

    @Test
    @DisplayName("Should clear every document and report the removed chunk count")
    void shouldClearDocuments() {
      when(vectorIndex.clear()).thenReturn(7L);

      ClearResult result = pipeline.clearDocuments();

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getMessage()).isEqualTo("All documents cleared successfully");
      assertThat(result.getChunksRemoved()).isEqualTo(7L);
      assertThat(result.getErrorCode()).isNull();
      assertThat(meterRegistry.counter("rag.document.cleared").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return a storage failure instead of throwing when clearing fails")
    void shouldNotThrowOnClearFailure() {
      when(vectorIndex.clear()).thenThrow(new StorageException("cluster red"));

      ClearResult result = pipeline.clearDocuments();

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getErrorCode()).isEqualTo(ErrorCode.STORAGE_FAILURE);
      assertThat(result.getMessage()).isEqualTo("Failed to clear documents");
    }

    @Test
    @DisplayName("Should report whether a document was deleted")
    void shouldDelete() {
      when(vectorIndex.delete("doc-1")).thenReturn(true);
      when(vectorIndex.delete("missing")).thenReturn(false);

      assertThat(pipeline.deleteDocument("doc-1")).isTrue();
      assertThat(pipeline.deleteDocument("missing")).isFalse();
      assertThat(pipeline.deleteDocument(" ")).isFalse();
    }

    @Test
    @DisplayName("Should return false instead of throwing when deletion fails")
    void shouldNotThrowOnDeleteFailure() {
      when(vectorIndex.delete("doc-1")).thenThrow(new StorageException("timeout"));

      assertThat(pipeline.deleteDocument("doc-1")).isFalse();
    }

    @Test
    @DisplayName("Should report zero stats when the index cannot be read")
    void shouldReturnEmptyStatsOnFailure() {
      when(vectorIndex.stats("doc-1")).thenThrow(new StorageException("timeout"));

      assertThat(pipeline.documentStats("doc-1")).isEqualTo(DocumentStats.empty("doc-1"));
    }

    @Test
    @DisplayName("Should report a healthy status with index and model details")
    void shouldReportHealthyStatus() {
      when(vectorIndex.stats()).thenReturn(new IndexStats(42, "pdf-documents"));
      when(embeddingService.describeModel()).thenReturn("AllMiniLmL6V2EmbeddingModel");
      when(embeddingService.dimension()).thenReturn(384);
      when(answerGenerationService.availableBackends()).thenReturn(List.of("openai"));

      SystemStatus status = pipeline.status();

      assertThat(status.isHealthy()).isTrue();
      assertThat(status.getTotalChunks()).isEqualTo(42);
      assertThat(status.getVectorStoreType()).isEqualTo("memory");
      assertThat(status.getEmbeddingDimension()).isEqualTo(384);
      assertThat(status.getAvailableGenerationBackends()).containsExactly("openai");
      assertThat(status.getChunkSize()).isEqualTo(1000);
    }

    @Test
    @DisplayName("Should report unhealthy when the index is unreachable")
    void shouldReportUnhealthyStatus() {
      when(vectorIndex.stats()).thenThrow(new StorageException("connection refused"));

      SystemStatus status = pipeline.status();

      assertThat(status.isHealthy()).isFalse();
      assertThat(status.getError()).contains("connection refused");
    }
  }
}
