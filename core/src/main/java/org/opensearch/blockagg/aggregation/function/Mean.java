/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import org.opensearch.blockagg.page.Block;

/** Arithmetic mean of a numeric column, accumulated as a running sum and count. */
public class Mean extends NullableAggregation<Mean.State, Double> {

  /** Partial mean: sum and number of non-null values. */
  public record State(double sum, long count) {}

  public Mean(String on) {
    this(on, true);
  }

  public Mean(String on, boolean ignoreNulls) {
    this("mean(" + on + ")", on, ignoreNulls);
  }

  public Mean(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected State aggregateColumn(Block column) {
    Number sum = ColumnAggregations.sum(column, true);
    if (sum == null) {
      return null;
    }
    return new State(sum.doubleValue(), ColumnAggregations.count(column));
  }

  @Override
  protected State mergeValues(State left, State right) {
    return new State(left.sum() + right.sum(), left.count() + right.count());
  }

  @Override
  protected Double finalizeValue(State value) {
    return value.sum() / value.count();
  }
}
