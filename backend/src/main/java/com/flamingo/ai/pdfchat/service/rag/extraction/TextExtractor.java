package com.flamingo.ai.pdfchat.service.rag.extraction;

import java.io.IOException;
import java.util.Locale;

/**
 * Turns uploaded document bytes into plain text with {@code --- Page N ---} markers before each
 * page's text.
 */
public interface TextExtractor {

  /** Whether this extractor handles the given file name (by extension). */
  boolean supports(String fileName);

  /**
   * Extracts text.
   *
   * @param bytes raw file content
   * @return marked-up text, possibly blank when the document has no extractable text
   * @throws IOException when the bytes cannot be parsed
   */
  String extract(byte[] bytes) throws IOException;

  /** Page marker the chunker splits on. */
  static String pageMarker(int pageNumber) {
    return "\n--- Page " + pageNumber + " ---\n";
  }

  static boolean hasExtension(String fileName, String... extensions) {
    if (fileName == null) {
      return false;
    }
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (String extension : extensions) {
      if (lower.endsWith(extension)) {
        return true;
      }
    }
    return false;
  }
}
