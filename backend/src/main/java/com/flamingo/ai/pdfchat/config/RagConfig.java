package com.flamingo.ai.pdfchat.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private VectorStore vectorStore = new VectorStore();
  private Generation generation = new Generation();
  private Upload upload = new Upload();
  private Query query = new Query();

  @Getter
  @Setter
  public static class Chunking {
    /** Window size in characters. */
    private int size = 1000;

    private int overlap = 200;

    /** Chunks whose trimmed length falls below this are never stored. */
    private int minChunkLength = 50;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;

    /** Minimum cosine similarity a chunk needs to be returned. Kept low for sparse corpora. */
    private double similarityThreshold = 0.1;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** "local" (in-process all-MiniLM-L6-v2) or "openai". */
    private String provider = "local";

    private int batchSize = 32;
    private Duration timeout = Duration.ofSeconds(30);
    private Retry retry = new Retry();
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** "memory" (default) or "elasticsearch". */
    private String type = "memory";

    private String indexName = "pdf-documents";

    /** Must match the embedding model output. */
    private int dimensions = 384;

    private Duration timeout = Duration.ofSeconds(10);
  }

  @Getter
  @Setter
  public static class Generation {
    /**
     * Backends tried in order. External APIs come first, then the local model. The extractive
     * responder always runs last and is not listed.
     */
    private List<String> providers =
        new ArrayList<>(List.of("cohere-chat", "openai", "anthropic", "ollama"));

    private Duration timeout = Duration.ofSeconds(30);
    private Retry retry = new Retry(1, Duration.ofSeconds(1), false);
    private int maxResponseChars = 1000;
    private int minResponseChars = 10;

    /** Prior turns passed to the backend (three exchanges). */
    private int historyWindow = 6;

    private int fallbackSnippetChars = 200;
    private int fallbackChunkCount = 2;
  }

  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private Duration waitDuration = Duration.ofMillis(500);
    private boolean exponentialBackoff = true;

    public Retry() {}

    public Retry(int maxAttempts, Duration waitDuration, boolean exponentialBackoff) {
      this.maxAttempts = maxAttempts;
      this.waitDuration = waitDuration;
      this.exponentialBackoff = exponentialBackoff;
    }
  }

  @Getter
  @Setter
  public static class Upload {
    private long maxFileSizeBytes = 10 * 1024 * 1024L; // 10 MB
  }

  @Getter
  @Setter
  public static class Query {
    private int maxLength = 1000;
    private double minTemperature = 0.0;
    private double maxTemperature = 1.0;
    private int minMaxTokens = 50;
    private int maxMaxTokens = 2000;
  }
}
