package com.gentoro.onerag.manifest;

import java.time.Instant;
import java.util.Map;

public record DocumentRecord(
    String docId,
    String path,
    String mimeType,
    String scope,
    Instant sourceMtime,
    String fileHash,
    Map<String, Object> metadata,
    Instant ingestedAt,
    DocumentStatus status) {}
