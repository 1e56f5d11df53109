/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import java.util.function.Function;
import lombok.experimental.UtilityClass;
import org.opensearch.blockagg.page.Block;
import org.opensearch.blockagg.sort.ValueComparator;

/**
 * Aggregations over a single column block. Every helper returns null ("no value") for an empty
 * block, for a block without non-null values, and, when {@code ignoreNulls} is false, for a block
 * containing any null. {@link #count(Block)} never returns null: an all-null column counts 0.
 */
@UtilityClass
public class ColumnAggregations {

  /** Number of non-null values. */
  public static long count(Block column) {
    long count = 0;
    for (int i = 0; i < column.getPositionCount(); i++) {
      if (!column.isNull(i)) {
        count++;
      }
    }
    return count;
  }

  /** Sum of the values. Integral inputs sum to a {@code Long} until they overflow. */
  public static Number sum(Block column, boolean ignoreNulls) {
    return applyAggregation(
        column,
        ignoreNulls,
        block -> {
          Number sum = null;
          for (int i = 0; i < block.getPositionCount(); i++) {
            Object value = block.getValue(i);
            if (value != null) {
              sum = NumericValues.add(sum == null ? 0L : sum, value);
            }
          }
          return sum;
        });
  }

  public static Object min(Block column, boolean ignoreNulls) {
    return applyAggregation(column, ignoreNulls, block -> extreme(block, -1));
  }

  public static Object max(Block column, boolean ignoreNulls) {
    return applyAggregation(column, ignoreNulls, block -> extreme(block, 1));
  }

  public static Double mean(Block column, boolean ignoreNulls) {
    return applyAggregation(
        column,
        ignoreNulls,
        block -> {
          double sum = 0;
          long count = 0;
          for (int i = 0; i < block.getPositionCount(); i++) {
            Object value = block.getValue(i);
            if (value != null) {
              sum += NumericValues.toDouble(value);
              count++;
            }
          }
          return sum / count;
        });
  }

  /**
   * Sum of squared differences of the values from their mean.
   *
   * @param mean precomputed mean of the column, or null to compute it
   */
  public static Double sumOfSquaredDiffsFromMean(Block column, boolean ignoreNulls, Double mean) {
    if (column.isAllNull()) {
      return null;
    }
    Double center = mean != null ? mean : mean(column, ignoreNulls);
    if (center == null) {
      return null;
    }
    return applyAggregation(
        column,
        ignoreNulls,
        block -> {
          double sum = 0;
          for (int i = 0; i < block.getPositionCount(); i++) {
            Object value = block.getValue(i);
            if (value != null) {
              double diff = NumericValues.toDouble(value) - center;
              sum += diff * diff;
            }
          }
          return sum;
        });
  }

  /**
   * Applies an aggregation with null handling. A {@link ClassCastException} raised by the
   * aggregation is reported as "no value" when the column holds nothing but nulls, and rethrown
   * otherwise. A NaN result is also reported as "no value".
   */
  public static <T> T applyAggregation(
      Block column, boolean ignoreNulls, Function<Block, T> aggregation) {
    if (column.getPositionCount() == 0) {
      return null;
    }
    if (!ignoreNulls && column.hasNull()) {
      return null;
    }
    T result;
    try {
      result = aggregation.apply(column);
    } catch (ClassCastException e) {
      if (column.isAllNull()) {
        return null;
      }
      throw e;
    }
    if (result instanceof Double && ((Double) result).isNaN()) {
      return null;
    }
    return result;
  }

  private static Object extreme(Block block, int direction) {
    Object best = null;
    for (int i = 0; i < block.getPositionCount(); i++) {
      Object value = block.getValue(i);
      if (value != null && (best == null || direction * ValueComparator.compare(value, best) > 0)) {
        best = value;
      }
    }
    return best;
  }
}
