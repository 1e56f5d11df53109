/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.blockagg.page.ArrayBlock;
import org.opensearch.blockagg.page.Block;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ColumnAggregationsTest {

  @Test
  void should_count_non_null_values() {
    assertEquals(2, ColumnAggregations.count(block(1, null, 3)));
    assertEquals(0, ColumnAggregations.count(block(null, null)));
    assertEquals(0, ColumnAggregations.count(block()));
  }

  @Test
  void should_sum_integral_values_as_long() {
    assertEquals(6L, ColumnAggregations.sum(block(1, 2, 3), true));
    assertEquals(5L, ColumnAggregations.sum(block(5), true));
    assertEquals(4L, ColumnAggregations.sum(block(1, null, 3), true));
  }

  @Test
  void should_widen_sum_on_overflow_and_mixed_types() {
    assertEquals(
        new BigDecimal(Long.MAX_VALUE).add(BigDecimal.ONE),
        ColumnAggregations.sum(block(Long.MAX_VALUE, 1L), true));
    assertEquals(3.5, ColumnAggregations.sum(block(1, 2.5), true));
    assertEquals(
        new BigDecimal("3.5"), ColumnAggregations.sum(block(1, new BigDecimal("2.5")), true));
  }

  @Test
  void should_return_no_value_for_empty_all_null_or_poisoned_columns() {
    assertNull(ColumnAggregations.sum(block(), true));
    assertNull(ColumnAggregations.sum(block(null, null), true));
    assertNull(ColumnAggregations.sum(block(1, null), false));
    assertNull(ColumnAggregations.min(block((Object) null), true));
    assertNull(ColumnAggregations.mean(block(null, null), true));
    assertNull(ColumnAggregations.max(block(1, null), false));
    assertNull(ColumnAggregations.sumOfSquaredDiffsFromMean(block(null, null), true, 5.0));
    assertNull(ColumnAggregations.sumOfSquaredDiffsFromMean(block(), true, 5.0));
    assertNull(ColumnAggregations.sumOfSquaredDiffsFromMean(block(1, null), false, 1.0));
  }

  @Test
  void should_find_min_and_max_across_types() {
    assertEquals(1, ColumnAggregations.min(block(3, 1, 2.5, null), true));
    assertEquals(3, ColumnAggregations.max(block(3, 1, 2.5, null), true));
    assertEquals("apple", ColumnAggregations.min(block("pear", "apple"), true));
  }

  @Test
  void should_compute_mean_and_squared_differences() {
    assertEquals(2.0, ColumnAggregations.mean(block(1, 2, 3, null), true));
    assertEquals(2.0, ColumnAggregations.sumOfSquaredDiffsFromMean(block(1, 2, 3), true, null));
    assertEquals(5.0, ColumnAggregations.sumOfSquaredDiffsFromMean(block(1, 2, 3), true, 1.0));
  }

  @Test
  void should_rethrow_class_cast_exception_for_non_numeric_values() {
    assertThrows(ClassCastException.class, () -> ColumnAggregations.sum(block("a", "b"), true));
  }

  @Test
  void should_report_class_cast_exception_on_all_null_column_as_no_value() {
    assertNull(
        ColumnAggregations.applyAggregation(
            block(null, null),
            true,
            column -> {
              throw new ClassCastException("not a number");
            }));
  }

  @Test
  void should_report_nan_as_no_value() {
    assertNull(ColumnAggregations.applyAggregation(block(1.0), true, column -> Double.NaN));
  }

  private static Block block(Object... values) {
    return new ArrayBlock(values);
  }
}
