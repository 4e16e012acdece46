package com.gentoro.onerag.vector;

public record HealthStatus(boolean healthy, String message) {}
