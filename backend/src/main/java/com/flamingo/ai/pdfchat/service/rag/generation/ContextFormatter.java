package com.flamingo.ai.pdfchat.service.rag.generation;

import com.flamingo.ai.pdfchat.service.rag.model.RetrievedChunk;
import java.util.ArrayList;
import java.util.List;

/** Renders retrieved chunks as the context block handed to generation backends. */
public final class ContextFormatter {

  public static final String NO_CONTEXT = "No relevant context found.";

  private ContextFormatter() {}

  /**
   * Formats chunks as {@code [Source i - Page p]} blocks separated by blank lines.
   *
   * @param chunks chunks in rank order
   * @return the context text, or {@link #NO_CONTEXT} for an empty list
   */
  public static String format(List<RetrievedChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return NO_CONTEXT;
    }
    List<String> parts = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      RetrievedChunk chunk = chunks.get(i);
      parts.add("[Source " + (i + 1) + " - Page " + chunk.pageNumber() + "]\n" + chunk.content());
    }
    return String.join("\n\n", parts);
  }
}
