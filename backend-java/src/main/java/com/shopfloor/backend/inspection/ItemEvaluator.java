package com.shopfloor.backend.inspection;

import java.math.BigDecimal;

/**
 * Conformance rule per item type. Pure and total: any recorded value, including nulls and values
 * of the wrong shape, resolves to {@code true} or {@code false}.
 */
public final class ItemEvaluator {
  private ItemEvaluator() {}

  public static boolean evaluate(ChecklistTemplateItem item, Object recorded) {
    if (item == null || item.type() == null) {
      return false;
    }
    return switch (item.type()) {
      // expectedValue is deliberately not consulted for boolean items
      case BOOLEAN -> Boolean.TRUE.equals(recorded);
      case NUMERIC -> withinTolerance(item, recorded);
      case TEXT -> textMatches(item, recorded);
    };
  }

  private static boolean withinTolerance(ChecklistTemplateItem item, Object recorded) {
    if (item.expectedValue() == null) {
      // no target: stays failed until an inspector overrides it
      return false;
    }
    double expected = toNumber(item.expectedValue());
    double value = toNumber(recorded);
    if (Double.isNaN(expected) || Double.isNaN(value)) {
      return false;
    }
    double tolerance = item.tolerance() == null ? 0d : item.tolerance();
    return value >= expected - tolerance && value <= expected + tolerance;
  }

  private static boolean textMatches(ChecklistTemplateItem item, Object recorded) {
    String expected = toText(item.expectedValue());
    String value = toText(recorded);
    if (!expected.isEmpty()) {
      return value.equals(expected);
    }
    return !value.trim().isEmpty();
  }

  /** Numeric view of a recorded or expected value; {@code NaN} when it has none. */
  static double toNumber(Object v) {
    if (v instanceof Number) {
      return ((Number) v).doubleValue();
    }
    if (v instanceof String) {
      String t = ((String) v).trim();
      if (t.isEmpty()) {
        return Double.NaN;
      }
      try {
        return new BigDecimal(t).doubleValue();
      } catch (NumberFormatException e) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  static String toText(Object v) {
    if (v == null) {
      return "";
    }
    return v instanceof String ? (String) v : String.valueOf(v);
  }
}
