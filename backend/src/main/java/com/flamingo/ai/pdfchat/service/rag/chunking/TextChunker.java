package com.flamingo.ai.pdfchat.service.rag.chunking;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.service.rag.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.model.PageText;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits extracted document text into overlapping passages aligned to sentence boundaries.
 *
 * <p>The text is normalised first (whitespace collapsed, characters outside a safe printable set
 * replaced). A window of {@code size} characters then slides over it; each cut moves back to the
 * last sentence terminator when that terminator lies past the window midpoint. Consecutive chunks
 * share {@code overlap} characters so context survives chunk boundaries.
 *
 * <p>Stateless and safe for concurrent use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  /** Marker inserted by the text extractors before each page. */
  public static final Pattern PAGE_MARKER = Pattern.compile("---\\s*Page\\s+(\\d+)\\s*---");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern UNSAFE_CHARS =
      Pattern.compile("[^\\w\\s\\-.,!?;:()\\[\\]{}\"]", Pattern.UNICODE_CHARACTER_CLASS);

  private final RagConfig ragConfig;

  /**
   * Chunks a whole extracted document, page by page.
   *
   * <p>Each page is chunked independently and its chunks carry that page's number. Chunk indices
   * run continuously across the document. Text that precedes the first marker, or a document
   * without markers, counts as page 1.
   *
   * @param extractedText text with {@code --- Page N ---} markers
   * @param documentId id stamped on every chunk
   * @param fileName original file name, kept in chunk metadata
   * @return ordered chunks, possibly empty when nothing passes the length floor
   */
  public List<DocumentChunk> chunkDocument(
      String extractedText, String documentId, String fileName) {
    int size = ragConfig.getChunking().getSize();
    int overlap = ragConfig.getChunking().getOverlap();

    List<DocumentChunk> result = new ArrayList<>();
    for (PageText page : splitPages(extractedText)) {
      for (String content : chunk(page.text(), size, overlap)) {
        int chunkIndex = result.size();
        result.add(
            DocumentChunk.builder()
                .id(DocumentChunk.chunkId(documentId, chunkIndex))
                .documentId(documentId)
                .content(content)
                .pageNumber(page.pageNumber())
                .chunkIndex(chunkIndex)
                .metadata(
                    Map.of(
                        DocumentChunk.META_FILENAME, fileName,
                        DocumentChunk.META_CHUNK_LENGTH, content.length(),
                        DocumentChunk.META_PAGE_NUMBER, page.pageNumber()))
                .build());
      }
    }

    log.debug("Document {} ({}) split into {} chunks", documentId, fileName, result.size());
    return result;
  }

  /**
   * Normalises and splits text into chunks of at most {@code size} characters.
   *
   * @param text raw text
   * @param size maximum chunk length
   * @param overlap characters shared between consecutive chunks
   * @return trimmed chunks at or above the configured length floor
   */
  public List<String> chunk(String text, int size, int overlap) {
    if (size <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + size);
    }
    if (overlap < 0 || overlap >= size) {
      throw new IllegalArgumentException(
          "Overlap must be in [0, " + size + "), was " + overlap);
    }

    int minLength = ragConfig.getChunking().getMinChunkLength();
    List<String> chunks = new ArrayList<>();
    for (String raw : slidingWindow(normalize(text), size, overlap)) {
      String trimmed = raw.trim();
      if (trimmed.length() < minLength) {
        log.trace("Dropping short chunk ({} chars)", trimmed.length());
        continue;
      }
      chunks.add(trimmed);
    }
    return chunks;
  }

  /** Collapses whitespace and replaces characters outside the safe set. */
  public static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String collapsed = WHITESPACE.matcher(text).replaceAll(" ");
    String safe = UNSAFE_CHARS.matcher(collapsed).replaceAll(" ");
    return WHITESPACE.matcher(safe).replaceAll(" ").trim();
  }

  /** Splits marked-up extraction output into pages. */
  public static List<PageText> splitPages(String extractedText) {
    List<PageText> pages = new ArrayList<>();
    if (extractedText == null || extractedText.isBlank()) {
      return pages;
    }

    Matcher matcher = PAGE_MARKER.matcher(extractedText);
    int currentPage = 1;
    int segmentStart = 0;
    while (matcher.find()) {
      addPage(pages, currentPage, extractedText.substring(segmentStart, matcher.start()));
      currentPage = parsePageNumber(matcher.group(1), currentPage);
      segmentStart = matcher.end();
    }
    addPage(pages, currentPage, extractedText.substring(segmentStart));
    return pages;
  }

  private static int parsePageNumber(String digits, int currentPage) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      log.warn("Page marker number {} out of range, staying on page {}", digits, currentPage);
      return currentPage;
    }
  }

  private static void addPage(List<PageText> pages, int pageNumber, String text) {
    if (!text.isBlank()) {
      pages.add(new PageText(pageNumber, text));
    }
  }

  // ---- sliding window ----

  static List<String> slidingWindow(String text, int size, int overlap) {
    List<String> chunks = new ArrayList<>();
    if (text.length() <= size) {
      chunks.add(text);
      return chunks;
    }

    int start = 0;
    while (start < text.length()) {
      int end = start + size;
      if (end >= text.length()) {
        chunks.add(text.substring(start));
        break;
      }

      int breakPoint = lastSentenceTerminator(text, start, end);
      if (breakPoint - start > size / 2) {
        end = breakPoint + 1;
      }
      chunks.add(text.substring(start, end));

      // Next window starts overlap characters before the cut, never behind the current start
      int next = end - overlap;
      if (next <= start) {
        next = Math.min(start + size - overlap, end);
      }
      start = next;
    }
    return chunks;
  }

  private static int lastSentenceTerminator(String text, int start, int end) {
    for (int i = end - 1; i >= start; i--) {
      char c = text.charAt(i);
      if (c == '.' || c == '?' || c == '!') {
        return i;
      }
    }
    return -1;
  }
}
