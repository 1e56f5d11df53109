/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import org.opensearch.blockagg.page.Block;
import org.opensearch.blockagg.sort.ValueComparator;

/** Largest value of a column of mutually comparable values. */
public class Max extends NullableAggregation<Object, Object> {

  public Max(String on) {
    this(on, true);
  }

  public Max(String on, boolean ignoreNulls) {
    this("max(" + on + ")", on, ignoreNulls);
  }

  public Max(String name, String on, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
  }

  @Override
  protected Object aggregateColumn(Block column) {
    return ColumnAggregations.max(column, true);
  }

  @Override
  protected Object mergeValues(Object left, Object right) {
    return ValueComparator.compare(right, left) > 0 ? right : left;
  }

  @Override
  protected Object finalizeValue(Object value) {
    return value;
  }
}
