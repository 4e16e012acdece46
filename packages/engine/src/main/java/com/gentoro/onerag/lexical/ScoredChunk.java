package com.gentoro.onerag.lexical;

/** A lexical match. */
public record ScoredChunk(String chunkId, double score) {}
