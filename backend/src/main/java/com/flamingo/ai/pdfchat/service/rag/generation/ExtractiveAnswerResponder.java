package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Last-resort answerer used when no generation backend succeeds. Quotes the top retrieved chunks
 * behind a phrase chosen from keywords in the question. Never fails.
 */
@Component
@RequiredArgsConstructor
public class ExtractiveAnswerResponder {

  static final String NO_CHUNKS_ANSWER =
      "I couldn't find relevant information in the document to answer your question.";

  private final RagConfig ragConfig;

  public String respond(String question, List<RetrievedChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return NO_CHUNKS_ANSWER;
    }

    int snippetChars = ragConfig.getGeneration().getFallbackSnippetChars();
    String combined =
        chunks.stream()
            .limit(Math.max(1, ragConfig.getGeneration().getFallbackChunkCount()))
            .map(chunk -> truncate(chunk.content(), snippetChars))
            .collect(Collectors.joining(" "));

    String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
    if (containsAny(q, "what", "about", "describe", "summary", "summarize")) {
      return "Based on the document, this appears to be about: " + combined;
    } else if (containsAny(q, "when", "time", "date", "schedule")) {
      return "According to the document: " + combined;
    } else if (containsAny(q, "where", "location", "place")) {
      return "The document mentions: " + combined;
    } else if (containsAny(q, "who", "person", "people")) {
      return "From the document: " + combined;
    } else if (containsAny(q, "how", "process", "method")) {
      return "The document explains: " + combined;
    }
    return "Based on your question about '"
        + question
        + "', here's what I found in the document: "
        + combined;
  }

  private static String truncate(String content, int maxChars) {
    return content.length() > maxChars ? content.substring(0, maxChars) + "..." : content;
  }

  // Substring match, so "whatever" counts as "what"
  private static boolean containsAny(String text, String... words) {
    for (String word : words) {
      if (text.contains(word)) {
        return true;
      }
    }
    return false;
  }
}
