/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import org.opensearch.blockagg.page.Block;
import org.opensearch.blockagg.sort.ValueComparator;

/** Smallest value of a column of mutually comparable values. */
public class Min extends NullableAggregation<Object, Object> {

  public Min(String on) {
    this(on, true);
  }

  public Min(String on, boolean ignoreNulls) {
    this("min(" + on + ")", on, ignoreNulls);
  }

  public Min(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected Object aggregateColumn(Block column) {
    return ColumnAggregations.min(column, true);
  }

  @Override
  protected Object mergeValues(Object left, Object right) {
    return ValueComparator.compare(right, left) < 0 ? right : left;
  }

  @Override
  protected Object finalizeValue(Object value) {
    return value;
  }
}
