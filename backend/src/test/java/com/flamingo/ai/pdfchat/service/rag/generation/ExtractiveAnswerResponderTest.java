package com.flamingo.ai.pdfchat.service.rag.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ExtractiveAnswerResponder Tests")
class ExtractiveAnswerResponderTest {

  private ExtractiveAnswerResponder responder;

  @BeforeEach
  void setUp() {
    responder = new ExtractiveAnswerResponder(new RagConfig());
  }

  private static RetrievedChunk retrieved(String content, int rank) {
    DocumentChunk chunk =
        DocumentChunk.builder()
            .id("doc_" + rank)
            .documentId("doc")
            .content(content)
            .pageNumber(1)
            .chunkIndex(rank)
            .build();
    return new RetrievedChunk(chunk, 0.9, rank);
  }

  @ParameterizedTest(name = "{0}")
  @CsvSource({
    "'What is this report?', 'Based on the document, this appears to be about: '",
    "'When is the deadline?', 'According to the document: '",
    "'Where is the office?', 'The document mentions: '",
    "'Who signed it?', 'From the document: '",
    "'How does approval work?', 'The document explains: '"
  })
  @DisplayName("Should phrase the answer by question keyword")
  void shouldPhraseByKeyword(String question, String prefix) {
    String answer = responder.respond(question, List.of(retrieved("Revenue grew 12%.", 1)));

    assertThat(answer).isEqualTo(prefix + "Revenue grew 12%.");
  }

  @Test
  @DisplayName("Should echo the question when no keyword matches")
  void shouldEchoQuestionOtherwise() {
    String answer = responder.respond("Revenue figures", List.of(retrieved("Revenue grew.", 1)));

    assertThat(answer)
        .isEqualTo(
            "Based on your question about 'Revenue figures', here's what I found in the "
                + "document: Revenue grew.");
  }

  @Test
  @DisplayName("Should quote at most two chunks truncated to 200 characters")
  void shouldQuoteTopTwoChunksTruncated() {
    String longContent = "x".repeat(250);
    String answer =
        responder.respond(
            "Revenue figures",
            List.of(retrieved(longContent, 1), retrieved("second", 2), retrieved("third", 3)));

    assertThat(answer).contains("x".repeat(200) + "... second").doesNotContain("third");
  }

  @Test
  @DisplayName("Should answer even without chunks")
  void shouldHandleNoChunks() {
    assertThat(responder.respond("What?", List.of()))
        .isEqualTo(ExtractiveAnswerResponder.NO_CHUNKS_ANSWER);
  }
}
