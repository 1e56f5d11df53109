/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import org.opensearch.blockagg.page.Block;

/**
 * Base of the second moment aggregations. Each partial result keeps the count, mean and sum of
 * squared differences from the mean (M2) of its rows; partials are combined with the pairwise
 * update of Chan et al., which keeps the result independent of how rows were split.
 *
 * @param <R> result type
 */
public abstract class MomentAggregation<R> extends NullableAggregation<MomentAggregation.State, R> {

  /** Count, mean and M2 of a set of values. */
  public record State(long count, double mean, double m2) {}

  protected MomentAggregation(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected State aggregateColumn(Block column) {
    Double mean = ColumnAggregations.mean(column, true);
    if (mean == null) {
      return null;
    }
    Double m2 = ColumnAggregations.sumOfSquaredDiffsFromMean(column, true, mean);
    return new State(ColumnAggregations.count(column), mean, m2);
  }

  @Override
  protected State mergeValues(State left, State right) {
    long count = left.count() + right.count();
    double delta = right.mean() - left.mean();
    double mean = left.mean() + delta * right.count() / count;
    double m2 =
        left.m2() + right.m2() + delta * delta * ((double) left.count() * right.count() / count);
    return new State(count, mean, m2);
  }
}
