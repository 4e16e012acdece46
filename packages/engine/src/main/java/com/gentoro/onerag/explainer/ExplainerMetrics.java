package com.gentoro.onerag.explainer;

public record ExplainerMetrics(
    long selectionCount,
    long retryCount,
    long validationFailures,
    String model,
    double temperature,
    int maxSelected,
    int minSelected) {}
