package com.gentoro.onerag.ingestion.chunk;

/**
 * A token-bounded slice of extracted document text.
 *
 * @param index 0-based position within the document
 * @param offsetStart UTF-8 byte offset of the first byte in the extracted text
 * @param offsetEnd UTF-8 byte offset one past the last byte
 * @param chunkHash SHA-256 hex digest of {@code text}
 */
public record Chunk(
    String text,
    int index,
    long offsetStart,
    long offsetEnd,
    String chunkHash,
    int tokenCount) {}
