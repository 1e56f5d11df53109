/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import java.math.BigDecimal;
import java.math.BigInteger;
import lombok.experimental.UtilityClass;

/**
 * Arithmetic over boxed cell values. Integral inputs stay {@link Long} until they overflow, any
 * {@link BigDecimal} or {@link BigInteger} input widens to {@code BigDecimal}, everything else is
 * computed in double precision. Non-numeric values fail with {@link ClassCastException}.
 */
@UtilityClass
class NumericValues {

  static Number add(Object left, Object right) {
    Number l = (Number) left;
    Number r = (Number) right;
    if (isBig(l) || isBig(r)) {
      return toBigDecimal(l).add(toBigDecimal(r));
    }
    if (isIntegral(l) && isIntegral(r)) {
      long a = l.longValue();
      long b = r.longValue();
      long sum = a + b;
      if (((a ^ sum) & (b ^ sum)) < 0) {
        return BigDecimal.valueOf(a).add(BigDecimal.valueOf(b));
      }
      return sum;
    }
    return l.doubleValue() + r.doubleValue();
  }

  static double toDouble(Object value) {
    return ((Number) value).doubleValue();
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
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
