package com.gentoro.onerag.vector;

import java.util.Map;
import java.util.Objects;

/** Client-side evaluation of the filter maps accepted by {@link VectorIndexClient}. */
public final class PayloadFilters {
  private PayloadFilters() {}

  /** True when every filter entry holds for {@code payload}. A null filter map matches all. */
  public static boolean matches(Map<String, Object> payload, Map<String, Object> filters) {
    if (filters == null) return true;
    for (Map.Entry<String, Object> f : filters.entrySet()) {
      Object actual = payload.get(f.getKey());
      if (f.getValue() instanceof RangeCondition range) {
        if (!range.test(actual)) return false;
      } else if (!valueEquals(f.getValue(), actual)) {
        return false;
      }
    }
    return true;
  }

  private static boolean valueEquals(Object expected, Object actual) {
    if (expected instanceof Number e && actual instanceof Number a) {
      return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
    }
    return Objects.equals(expected, actual);
  }
}
