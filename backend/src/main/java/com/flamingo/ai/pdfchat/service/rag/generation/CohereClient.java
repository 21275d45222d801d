package com.flamingo.ai.pdfchat.service.rag.generation;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the Cohere {@code /v1/chat} and {@code /v1/generate} endpoints. Encapsulates all
 * WebClient communication with Cohere.
 */
@Component
@Slf4j
public class CohereClient {

  private final WebClient webClient;
  private final String apiKey;
  private final String chatModel;
  private final String generateModel;
  private final Duration readTimeout;

  public CohereClient(
      @Value("${cohere.api-key:}") String apiKey,
      @Value("${cohere.base-url:https://api.cohere.ai}") String baseUrl,
      @Value("${cohere.chat-model:command-r-plus}") String chatModel,
      @Value("${cohere.generate-model:command}") String generateModel,
      @Value("${cohere.read-timeout:30s}") Duration readTimeout) {
    this.apiKey = apiKey;
    this.chatModel = chatModel;
    this.generateModel = generateModel;
    this.readTimeout = readTimeout;
    this.webClient =
        WebClient.builder()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .build();
    log.info("Cohere client initialized: baseUrl={}, configured={}", baseUrl, isConfigured());
  }

  public boolean isConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }

  /**
   * Calls {@code /v1/chat} with a single message.
   *
   * @return the response text, may be null when the body lacks one
   */
  public String chat(
      String message,
      String preamble,
      List<CohereChatTurn> chatHistory,
      double temperature,
      int maxTokens) {
    var request =
        new CohereChatRequest(chatModel, message, preamble, chatHistory, temperature, maxTokens);
    CohereChatResponse response =
        webClient
            .post()
            .uri("/v1/chat")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(CohereChatResponse.class)
            .timeout(readTimeout)
            .block();
    return response != null ? response.text() : null;
  }

  /**
   * Calls {@code /v1/generate} with one prompt.
   *
   * @return the first generation's text, may be null when the body lacks one
   */
  public String generate(String prompt, double temperature, int maxTokens) {
    var request = new CohereGenerateRequest(generateModel, prompt, maxTokens, temperature, "END");
    CohereGenerateResponse response =
        webClient
            .post()
            .uri("/v1/generate")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(CohereGenerateResponse.class)
            .timeout(readTimeout)
            .block();
    if (response == null || response.generations() == null || response.generations().isEmpty()) {
      return null;
    }
    return response.generations().get(0).text();
  }

  /** One prior message in Cohere's chat history format. */
  public record CohereChatTurn(String role, String message) {}

  record CohereChatRequest(
      String model,
      String message,
      String preamble,
      @JsonProperty("chat_history") List<CohereChatTurn> chatHistory,
      double temperature,
      @JsonProperty("max_tokens") int maxTokens) {}

  record CohereChatResponse(String text) {}

  record CohereGenerateRequest(
      String model,
      String prompt,
      @JsonProperty("max_tokens") int maxTokens,
      double temperature,
      String truncate) {}

  record CohereGenerateResponse(List<Generation> generations) {}

  record Generation(String text) {}
}
