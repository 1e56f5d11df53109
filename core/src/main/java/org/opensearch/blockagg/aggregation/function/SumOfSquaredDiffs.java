/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

/** Sum of squared differences of a numeric column from its mean. */
public class SumOfSquaredDiffs extends MomentAggregation<Double> {

  public SumOfSquaredDiffs(String on) {
    this(on, true);
  }

  public SumOfSquaredDiffs(String on, boolean ignoreNulls) {
    this("sum_of_squared_diffs(" + on + ")", on, ignoreNulls);
  }

  public SumOfSquaredDiffs(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected Double finalizeValue(State value) {
    return value.m2();
  }
}
