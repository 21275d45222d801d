package com.flamingo.ai.pdfchat.service.rag.model;

/** Text of one page as delimited by the extraction page markers. */
public record PageText(int pageNumber, String text) {}
