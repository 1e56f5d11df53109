/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import lombok.experimental.UtilityClass;

/**
 * Total order over cell values. Numbers compare by numeric value across boxed types, other values
 * through {@link Comparable}. Nulls sort after all non-null values in both directions.
 */
@UtilityClass
public class ValueComparator {

  private static final long MAX_EXACT_DOUBLE_INTEGER = 1L << 53;

  /** Compares two values in ascending order. */
  public static int compare(Object left, Object right) {
    return compare(left, right, SortOrder.ASCENDING);
  }

  /** Compares two values in the given direction. Nulls are last in either direction. */
  public static int compare(Object left, Object right, SortOrder order) {
    if (left == null || right == null) {
      if (left == right) {
        return 0;
      }
      return left == null ? 1 : -1;
    }
    int result = compareNonNull(left, right);
    return order == SortOrder.DESCENDING ? -result : result;
  }

  /**
   * Returns true if both values denote the same grouping value: numerically equal numbers, equal
   * objects, or both null.
   */
  public static boolean valuesEqual(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      return compareNumbers((Number) left, (Number) right) == 0;
    }
    return Objects.equals(left, right);
  }

  @SuppressWarnings("unchecked")
  private static int compareNonNull(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      return compareNumbers((Number) left, (Number) right);
    }
    if (left instanceof CharSequence && right instanceof CharSequence) {
      return left.toString().compareTo(right.toString());
    }
    if (left instanceof Comparable && left.getClass().isInstance(right)) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    if (right instanceof Comparable && right.getClass().isInstance(left)) {
      return -((Comparable<Object>) right).compareTo(left);
    }
    throw new IllegalArgumentException(
        String.format(
            "Cannot compare values of type %s and %s",
            left.getClass().getName(), right.getClass().getName()));
  }

  private static int compareNumbers(Number left, Number right) {
    if (isIntegral(left) && isIntegral(right)) {
      return Long.compare(left.longValue(), right.longValue());
    }
    if (isFloating(left) && !Double.isFinite(left.doubleValue())
        || isFloating(right) && !Double.isFinite(right.doubleValue())) {
      return Double.compare(left.doubleValue(), right.doubleValue());
    }
    if (isBig(left) || isBig(right)) {
      return toBigDecimal(left).compareTo(toBigDecimal(right));
    }
    if (isExactAsDouble(left) && isExactAsDouble(right)) {
      return Double.compare(left.doubleValue(), right.doubleValue());
    }
    // Integral values beyond 2^53 lose precision as doubles.
    return toExactDecimal(left).compareTo(toExactDecimal(right));
  }

  private static boolean isExactAsDouble(Number value) {
    if (!isIntegral(value)) {
      return true;
    }
    long integral = value.longValue();
    return integral >= -MAX_EXACT_DOUBLE_INTEGER && integral <= MAX_EXACT_DOUBLE_INTEGER;
  }

  private static BigDecimal toExactDecimal(Number value) {
    if (isIntegral(value)) {
      return BigDecimal.valueOf(value.longValue());
    }
    return new BigDecimal(value.doubleValue());
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  private static boolean isFloating(Number value) {
    return value instanceof Double || value instanceof Float;
  }

  private static boolean isBig(Number value) {
    return value instanceof BigDecimal || value instanceof BigInteger;
  }

  private static BigDecimal toBigDecimal(Number value) {
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    } else if (isIntegral(value)) {
      return BigDecimal.valueOf(value.longValue());
    }
    return BigDecimal.valueOf(value.doubleValue());
  }
}
