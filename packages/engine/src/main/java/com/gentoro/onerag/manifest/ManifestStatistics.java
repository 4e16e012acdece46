package com.gentoro.onerag.manifest;

import java.util.Map;

/** Aggregate counts over the manifest. */
public record ManifestStatistics(
    long documentsTotal,
    Map<String, Long> documentsByStatus,
    Map<String, Long> documentsByScope,
    long chunks,
    long embeddings,
    long jobsTotal,
    Map<String, Long> jobsByStatus) {}
