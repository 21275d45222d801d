package com.flamingo.ai.pdfchat.service.rag.extraction;

import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for PDF documents, using Apache PDFBox 3.x.
 *
 * <p>Text is stripped page by page. Pages without text are skipped but the following pages keep
 * their real page numbers.
 */
@Component
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public boolean supports(String fileName) {
    return TextExtractor.hasExtension(fileName, ".pdf");
  }

  @Override
  public String extract(byte[] bytes) throws IOException {
    try (PDDocument document = Loader.loadPDF(bytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      int pageCount = document.getNumberOfPages();
      int pagesWithText = 0;

      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(document);
        if (pageText != null && !pageText.isBlank()) {
          text.append(TextExtractor.pageMarker(page)).append(pageText).append('\n');
          pagesWithText++;
        }
      }

      log.debug("Extracted text from {} of {} PDF pages", pagesWithText, pageCount);
      return text.toString();
    }
  }
}
