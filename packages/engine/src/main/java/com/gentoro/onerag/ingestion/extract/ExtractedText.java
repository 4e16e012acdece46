package com.gentoro.onerag.ingestion.extract;

/** Text produced by an {@link Extractor}, tagged with the extractor identity. */
public record ExtractedText(String text, String extractor, String extractorVersion) {}
