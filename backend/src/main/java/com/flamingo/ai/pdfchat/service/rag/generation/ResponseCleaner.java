package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Tidies raw backend output before it is returned as an answer. */
@Component
@RequiredArgsConstructor
public class ResponseCleaner {

  private static final int REPEAT_WINDOW = 3;

  private final RagConfig ragConfig;

  /**
   * Strips speaker labels, drops lines repeating one of the previous three kept lines, and
   * truncates overly long output with {@code ...}.
   */
  public String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String text = raw.replace("Assistant:", "").replace("AI:", "").trim();

    List<String> kept = new ArrayList<>();
    for (String line : text.split("\n")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      List<String> recent = kept.subList(Math.max(0, kept.size() - REPEAT_WINDOW), kept.size());
      if (!recent.contains(trimmed)) {
        kept.add(trimmed);
      }
    }

    String cleaned = String.join("\n", kept);
    int maxChars = ragConfig.getGeneration().getMaxResponseChars();
    if (cleaned.length() > maxChars) {
      cleaned = cleaned.substring(0, maxChars) + "...";
    }
    return cleaned;
  }

  /** Whether cleaned output is long enough to count as an answer. */
  public boolean isUsable(String cleaned) {
    return cleaned != null
        && cleaned.strip().length() >= ragConfig.getGeneration().getMinResponseChars();
  }
}
