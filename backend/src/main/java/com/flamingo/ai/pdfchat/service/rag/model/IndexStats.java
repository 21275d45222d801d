package com.flamingo.ai.pdfchat.service.rag.model;

/** Whole-index statistics. */
public record IndexStats(long totalChunkCount, String indexName) {}
