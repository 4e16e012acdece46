package com.gentoro.onerag.ingestion;

import com.gentoro.onerag.manifest.JobStatus;
import java.util.List;

/**
 * Outcome of one {@link IngestionService#ingest} batch.
 *
 * @param documentsProcessed files visited, whether ingested, skipped or failed
 * @param documentsSkipped files whose content hash matched an already ingested document
 * @param errors one {@code path: message} entry per failed file
 */
public record IngestReport(
    String jobId,
    JobStatus status,
    int documentsProcessed,
    int documentsSkipped,
    int documentsFailed,
    int chunksCreated,
    int embeddingsCreated,
    List<String> errors) {

  public IngestReport {
    errors = List.copyOf(errors);
  }

  public int documentsIngested() {
    return documentsProcessed - documentsSkipped - documentsFailed;
  }
}
