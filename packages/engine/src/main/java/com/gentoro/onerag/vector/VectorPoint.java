package com.gentoro.onerag.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A vector with its id and payload, as stored in the vector engine. */
public record VectorPoint(String id, float[] vector, Map<String, Object> payload) {
  public VectorPoint {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(vector, "vector");
    payload =
        payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
