package com.gentoro.onerag.ingestion.extract;

import java.nio.file.Path;

/**
 * Converts one kind of source file into UTF-8 text. Every extractor carries a stable name and
 * version recorded with each chunk so a chunk can be traced back to the code that produced it.
 */
public interface Extractor {

  String name();

  String version();

  /**
   * Extracts the text of {@code path}.
   *
   * @throws com.gentoro.onerag.exception.ExtractionException when the file is unreadable or corrupt
   */
  ExtractedText extract(Path path);
}
