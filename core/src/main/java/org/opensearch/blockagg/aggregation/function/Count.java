/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import lombok.Getter;
import org.opensearch.blockagg.aggregation.AggregateFunction;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.page.Page;

/** Counts rows, or the non-null values of one column. Never "no value": empty groups count 0. */
public class Count implements AggregateFunction<Long, Long> {

  @Getter private final String name;

  /** Column to count non-null values of, or null to count rows. */
  @Getter private final String on;

  /** Counts rows, named {@code count}. */
  public Count() {
    this("count", null);
  }

  /** Counts non-null values of the column, named {@code count(on)}. */
  public Count(String on) {
    this("count(" + on + ")", on);
  }

  public Count(String name, String on) {
    this.name = name;
    this.on = on;
  }

  @Override
  public Long init(GroupKey groupKey) {
    return 0L;
  }

  @Override
  public Long accumulateBlock(Long accumulator, Page block) {
    if (on == null || block.isEmpty()) {
      return accumulator + block.getPositionCount();
    }
    return accumulator + ColumnAggregations.count(block.getBlock(on));
  }

  @Override
  public Long merge(Long left, Long right) {
    return left + right;
  }

  @Override
  public Long finalizeResult(Long accumulator) {
    return accumulator;
  }
}
