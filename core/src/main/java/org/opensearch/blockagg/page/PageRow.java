/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Read-only view of one row of a {@link Page}. Cells are exposed as typed optionals, empty when
 * the cell is null. Typed accessors convert according to the following table and fail with
 * {@link IllegalArgumentException} for any other combination:
 *
 * <pre>
 * cell type                     getLong          getDouble      getString      getBoolean
 * Byte, Short, Integer, Long    value            widened        toString()     -
 * BigInteger                    longValueExact   doubleValue    toString()     -
 * Float, Double                 -                widened        toString()     -
 * BigDecimal                    longValueExact   doubleValue    toPlainString  -
 * CharSequence                  -                -              toString()     -
 * Boolean                       -                -              toString()     value
 * </pre>
 */
@RequiredArgsConstructor
public class PageRow {

  @Getter private final Page page;
  @Getter private final int position;

  /** Returns the raw value of the given channel. */
  public Optional<Object> get(int channel) {
    return Optional.ofNullable(page.getValue(position, channel));
  }

  /** Returns the raw value of the named column. */
  public Optional<Object> get(String columnName) {
    return get(page.getChannel(columnName));
  }

  public Optional<Long> getLong(String columnName) {
    return get(columnName).map(value -> toLong(columnName, value));
  }

  public Optional<Double> getDouble(String columnName) {
    return get(columnName).map(value -> toDouble(columnName, value));
  }

  public Optional<String> getString(String columnName) {
    return get(columnName).map(PageRow::toStringValue);
  }

  public Optional<Boolean> getBoolean(String columnName) {
    return get(columnName)
        .map(
            value -> {
              if (value instanceof Boolean) {
                return (Boolean) value;
              }
              throw conversionError(columnName, value, "boolean");
            });
  }

  /** Copies the row values into a new array, in channel order. */
  public Object[] toArray() {
    Object[] values = new Object[page.getChannelCount()];
    for (int i = 0; i < values.length; i++) {
      values[i] = page.getValue(position, i);
    }
    return values;
  }

  private static long toLong(String columnName, Object value) {
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return ((Number) value).longValue();
    } else if (value instanceof BigInteger) {
      return ((BigInteger) value).longValueExact();
    } else if (value instanceof BigDecimal) {
      return ((BigDecimal) value).longValueExact();
    }
    throw conversionError(columnName, value, "long");
  }

  private static double toDouble(String columnName, Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    throw conversionError(columnName, value, "double");
  }

  private static String toStringValue(Object value) {
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).toPlainString();
    }
    return value.toString();
  }

  private static IllegalArgumentException conversionError(
      String columnName, Object value, String target) {
    return new IllegalArgumentException(
        String.format(
            "Cannot convert value [%s] of type %s in column [%s] to %s",
            value, value.getClass().getSimpleName(), columnName, target));
  }

  @Override
  public String toString() {
    return "PageRow{position=" + position + ", values=" + Arrays.toString(toArray()) + "}";
  }
}
