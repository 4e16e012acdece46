package com.gentoro.onerag.manifest;

import java.time.Instant;

public record IngestJob(
    String jobId,
    Instant startedAt,
    Instant completedAt,
    JobStatus status,
    int docsProcessed,
    int chunksCreated,
    int embeddingsCreated,
    String errorMessage) {}
