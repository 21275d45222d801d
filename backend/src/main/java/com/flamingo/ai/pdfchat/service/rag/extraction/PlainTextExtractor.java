package com.flamingo.ai.pdfchat.service.rag.extraction;

import java.nio.charset.StandardCharsets;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Plain text and Markdown files, decoded as UTF-8 and treated as a single page. */
@Component
@Order(2)
public class PlainTextExtractor implements TextExtractor {

  @Override
  public boolean supports(String fileName) {
    return TextExtractor.hasExtension(fileName, ".txt", ".md");
  }

  @Override
  public String extract(byte[] bytes) {
    String text = new String(bytes, StandardCharsets.UTF_8);
    return text.isBlank() ? "" : TextExtractor.pageMarker(1) + text;
  }
}
