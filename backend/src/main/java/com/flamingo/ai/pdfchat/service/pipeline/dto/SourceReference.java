package com.flamingo.ai.pdfchat.service.pipeline.dto;

/** Structured form of one source citation. */
public record SourceReference(
    String documentId, String filename, int pageNumber, double similarity, int rank) {}
