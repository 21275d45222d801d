package com.flamingo.ai.pdfchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point. The HTTP layer lives elsewhere and consumes {@code RagPipelineService}. */
@SpringBootApplication
public class PdfChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfChatApplication.class, args);
  }
}
