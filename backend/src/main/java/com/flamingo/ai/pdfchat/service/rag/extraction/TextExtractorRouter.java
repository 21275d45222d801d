package com.flamingo.ai.pdfchat.service.rag.extraction;

import com.flamingo.ai.pdfchat.exception.DocumentProcessingException;
import com.flamingo.ai.pdfchat.exception.ValidationException;
import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a file name to the highest-priority {@link TextExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  public boolean supports(String fileName) {
    return extractors.stream().anyMatch(e -> e.supports(fileName));
  }

  /**
   * Returns the highest-priority extractor for the file.
   *
   * @throws ValidationException if no extractor supports the file type
   */
  public TextExtractor route(String fileName) {
    return extractors.stream()
        .filter(e -> e.supports(fileName))
        .findFirst()
        .orElseThrow(() -> new ValidationException("Unsupported file type: " + fileName));
  }

  /**
   * Extracts text with the matching extractor.
   *
   * @throws ValidationException if the type is unsupported
   * @throws DocumentProcessingException if the content cannot be parsed
   */
  public String extract(byte[] bytes, String fileName) {
    TextExtractor extractor = route(fileName);
    try {
      String text = extractor.extract(bytes);
      log.debug(
          "{} extracted {} chars from {}",
          extractor.getClass().getSimpleName(),
          text.length(),
          fileName);
      return text;
    } catch (IOException e) {
      log.error("Text extraction failed for {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          fileName, "Failed to extract text from " + fileName + ": " + e.getMessage(), e);
    }
  }
}
