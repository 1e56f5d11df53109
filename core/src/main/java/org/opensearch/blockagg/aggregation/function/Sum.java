/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import org.opensearch.blockagg.page.Block;

/** Sum of a numeric column. A column of nulls sums to null, not zero. */
public class Sum extends NullableAggregation<Number, Number> {

  public Sum(String on) {
    this(on, true);
  }

  public Sum(String on, boolean ignoreNulls) {
    this("sum(" + on + ")", on, ignoreNulls);
  }

  public Sum(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected Number aggregateColumn(Block column) {
    return ColumnAggregations.sum(column, true);
  }

  @Override
  protected Number mergeValues(Number left, Number right) {
    return NumericValues.add(left, right);
  }

  @Override
  protected Number finalizeValue(Number value) {
    return value;
  }
}
