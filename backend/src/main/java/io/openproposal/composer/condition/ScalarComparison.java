package io.openproposal.composer.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Compares two scalars after coercing them to a common kind. Numbers win over booleans, which win
 * over strings; an operand that cannot be coerced to the chosen kind makes the comparison false.
 * Booleans only support equality.
 */
final class ScalarComparison {

  private ScalarComparison() {}

  static boolean test(Object actual, ConditionOperator operator, Object expected) {
    if (actual == null || expected == null || operator == null) {
      return false;
    }
    if (actual instanceof Number || expected instanceof Number) {
      BigDecimal left = toNumber(actual);
      BigDecimal right = toNumber(expected);
      return left != null && right != null && operator.test(left.compareTo(right));
    }
    if (actual instanceof Boolean || expected instanceof Boolean) {
      Boolean left = toBoolean(actual);
      Boolean right = toBoolean(expected);
      if (left == null || right == null || operator.isOrdering()) {
        return false;
      }
      return operator.test(left.equals(right) ? 0 : 1);
    }
    if (actual instanceof String left && expected instanceof String right) {
      return operator.test(left.compareTo(right));
    }
    return false;
  }

  static BigDecimal toNumber(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof BigInteger integer) {
      return new BigDecimal(integer);
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
    }
    if (value instanceof Number number) {
      return BigDecimal.valueOf(number.longValue());
    }
    if (value instanceof String text) {
      try {
        return new BigDecimal(text.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  static Boolean toBoolean(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String text) {
      return switch (text.trim().toLowerCase(Locale.ROOT)) {
        case "true" -> Boolean.TRUE;
        case "false" -> Boolean.FALSE;
        default -> null;
      };
    }
    return null;
  }
}
