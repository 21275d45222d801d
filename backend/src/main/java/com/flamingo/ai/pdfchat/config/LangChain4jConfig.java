package com.flamingo.ai.pdfchat.config;

import com.flamingo.ai.pdfchat.service.rag.generation.ChatModelGenerationBackend;
import com.flamingo.ai.pdfchat.service.rag.generation.GenerationBackend;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Chat backends whose credentials are missing are still registered, but report themselves as
 * unavailable so the generator skips them.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String openAiChatModelName;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String openAiEmbeddingModelName;

  @Value("${langchain4j.anthropic.api-key:}")
  private String anthropicApiKey;

  @Value("${langchain4j.anthropic.chat-model.model-name:claude-3-5-haiku-latest}")
  private String anthropicChatModelName;

  @Value("${langchain4j.ollama.enabled:false}")
  private boolean ollamaEnabled;

  @Value("${langchain4j.ollama.base-url:http://localhost:11434}")
  private String ollamaBaseUrl;

  @Value("${langchain4j.ollama.chat-model.model-name:llama3.2}")
  private String ollamaChatModelName;

  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    String provider = ragConfig.getEmbedding().getProvider();
    if ("openai".equalsIgnoreCase(provider)) {
      if (isBlank(openAiApiKey)) {
        throw new IllegalStateException(
            "OpenAI API key is required for rag.embedding.provider=openai. "
                + "Set OPENAI_API_KEY environment variable.");
      }
      log.info("Using OpenAI embedding model {}", openAiEmbeddingModelName);
      return OpenAiEmbeddingModel.builder()
          .apiKey(openAiApiKey)
          .modelName(openAiEmbeddingModelName)
          .dimensions(ragConfig.getVectorStore().getDimensions())
          .timeout(ragConfig.getEmbedding().getTimeout())
          .build();
    }
    if (!"local".equalsIgnoreCase(provider)) {
      throw new IllegalStateException("Unknown embedding provider: " + provider);
    }
    log.info("Using in-process all-MiniLM-L6-v2 embedding model");
    return new AllMiniLmL6V2EmbeddingModel();
  }

  @Bean
  public GenerationBackend openAiGenerationBackend(RagConfig ragConfig) {
    if (isBlank(openAiApiKey)) {
      return ChatModelGenerationBackend.unavailable(ChatModelGenerationBackend.OPENAI);
    }
    return new ChatModelGenerationBackend(
        ChatModelGenerationBackend.OPENAI,
        OpenAiChatModel.builder()
            .apiKey(openAiApiKey)
            .modelName(openAiChatModelName)
            .timeout(ragConfig.getGeneration().getTimeout())
            .logRequests(false)
            .logResponses(false)
            .build());
  }

  @Bean
  public GenerationBackend anthropicGenerationBackend(RagConfig ragConfig) {
    if (isBlank(anthropicApiKey)) {
      return ChatModelGenerationBackend.unavailable(ChatModelGenerationBackend.ANTHROPIC);
    }
    return new ChatModelGenerationBackend(
        ChatModelGenerationBackend.ANTHROPIC,
        AnthropicChatModel.builder()
            .apiKey(anthropicApiKey)
            .modelName(anthropicChatModelName)
            .timeout(ragConfig.getGeneration().getTimeout())
            .build());
  }

  @Bean
  public GenerationBackend ollamaGenerationBackend(RagConfig ragConfig) {
    if (!ollamaEnabled) {
      return ChatModelGenerationBackend.unavailable(ChatModelGenerationBackend.OLLAMA);
    }
    return new ChatModelGenerationBackend(
        ChatModelGenerationBackend.OLLAMA,
        OllamaChatModel.builder()
            .baseUrl(ollamaBaseUrl)
            .modelName(ollamaChatModelName)
            .timeout(ragConfig.getGeneration().getTimeout())
            .build());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
