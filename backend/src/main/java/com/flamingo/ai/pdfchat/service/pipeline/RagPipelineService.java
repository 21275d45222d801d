package com.flamingo.ai.pdfchat.service.pipeline;

import com.flamingo.ai.pdfchat.service.pipeline.dto.AnswerResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.AskRequest;
import com.flamingo.ai.pdfchat.service.pipeline.dto.ClearResult;
import com.flamingo.ai.pdfchat.service.pipeline.dto.SystemStatus;
import com.flamingo.ai.pdfchat.service.pipeline.dto.UploadResult;
import com.flamingo.ai.pdfchat.service.rag.model.ChatTurn;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentStats;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for ingesting documents and answering questions about them.
 *
 * <p>No method throws for expected failures: every problem is reported through the returned
 * result objects.
 */
public interface RagPipelineService {

  /**
   * Extracts, chunks, embeds and stores a document.
   *
   * @param bytes file content
   * @param filename original file name; its extension selects the extractor
   * @return success with the new document id and counts, or a failure with an error code
   */
  UploadResult uploadDocument(byte[] bytes, String filename);

  /**
   * Answers a question from the indexed documents.
   *
   * @param request question, optional document filter, history and sampling parameters
   * @return the answer with sources and confidence, or a failure result
   */
  AnswerResult ask(AskRequest request);

  /**
   * Answers a question from the indexed documents.
   *
   * @param query the question
   * @param documentId optional document filter
   * @param history prior turns, may be null
   * @param temperature sampling temperature in [0, 1]
   * @param maxTokens output token limit in [50, 2000]
   * @return the answer with sources and confidence, or a failure result
   */
  AnswerResult ask(
      String query, String documentId, List<ChatTurn> history, double temperature, int maxTokens);

  /**
   * Removes a document and all of its chunks.
   *
   * @param documentId the document id
   * @return false for blank or unknown ids and on storage failure
   */
  boolean deleteDocument(String documentId);

  /**
   * Removes every stored document. Never throws.
   *
   * @return outcome with the number of chunks removed
   */
  ClearResult clearDocuments();

  /**
   * Chunk and page counts of a document.
   *
   * @param documentId the document id
   * @return zero counts for unknown ids
   */
  DocumentStats documentStats(String documentId);

  /** Current health and configuration. */
  SystemStatus status();

  /** Runs {@link #uploadDocument} on the RAG executor. */
  CompletableFuture<UploadResult> uploadDocumentAsync(byte[] bytes, String filename);

  /** Runs {@link #ask(AskRequest)} on the RAG executor. */
  CompletableFuture<AnswerResult> askAsync(AskRequest request);
}
