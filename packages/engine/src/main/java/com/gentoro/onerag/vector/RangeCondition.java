package com.gentoro.onerag.vector;

/**
 * Numeric range filter value. Any bound may be null. Passed as a filter map value in place of an
 * exact-match value.
 */
public record RangeCondition(Double gt, Double gte, Double lt, Double lte) {

  public static RangeCondition between(double gte, double lte) {
    return new RangeCondition(null, gte, null, lte);
  }

  public static RangeCondition atLeast(double gte) {
    return new RangeCondition(null, gte, null, null);
  }

  public boolean test(Object value) {
    if (!(value instanceof Number number)) return false;
    double v = number.doubleValue();
    return (gt == null || v > gt)
        && (gte == null || v >= gte)
        && (lt == null || v < lt)
        && (lte == null || v <= lte);
  }
}
