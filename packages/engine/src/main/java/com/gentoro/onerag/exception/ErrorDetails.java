package com.gentoro.onerag.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, log-friendly view of a failure. */
public record ErrorDetails(
    String type,
    String message,
    OneRagErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
