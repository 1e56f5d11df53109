/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.combine;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.aggregation.AggregateColumnNames;
import org.opensearch.blockagg.aggregation.AggregateFunction;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.aggregation.GroupingKey;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.PageBuilder;
import org.opensearch.blockagg.sort.KeyComparator;

/**
 * Combine phase of a two-phase aggregation: collapses one page into a row per group holding the
 * group key and one partial accumulator per aggregation.
 *
 * <p>The input page must be sorted by the grouping columns so that equal keys are adjacent. The
 * output keeps that order, which is what the merge phase relies on. Output columns are the
 * grouping columns followed by the aggregation columns named by {@link AggregateColumnNames}.
 */
@Log4j2
public class BlockCombiner {

  /**
   * Combines a page, resolving a loosely typed key first.
   *
   * @param key a column name, a list of column names, or null for a global aggregation
   * @throws IllegalArgumentException if the key has any other type
   * @see GroupingKey#resolve(Object)
   */
  public Page combine(Page page, Object key, List<? extends AggregateFunction<?, ?>> aggregations) {
    return combine(page, GroupingKey.resolve(key), aggregations);
  }

  /**
   * Combines a page.
   *
   * @param page page sorted by the grouping columns
   * @param key grouping columns, or null to aggregate the whole page as one group
   * @param aggregations aggregations, in output order
   * @return one row per group: key columns then accumulators, in the input's key order
   */
  public Page combine(
      Page page, GroupingKey key, List<? extends AggregateFunction<?, ?>> aggregations) {
    List<String> keyColumns = key == null ? List.of() : key.getColumnNames();
    List<String> aggregationColumns = AggregateColumnNames.resolve(aggregations);
    PageBuilder builder =
        new PageBuilder(
            ImmutableList.<String>builder().addAll(keyColumns).addAll(aggregationColumns).build());

    if (key == null) {
      // one global group, even when the page is empty
      appendGroup(builder, GroupKey.global(), page, aggregations);
    } else if (!page.isEmpty()) {
      GroupRunIterator runs = new GroupRunIterator(page, KeyComparator.channels(page, keyColumns));
      while (runs.hasNext()) {
        GroupRun run = runs.next();
        appendGroup(builder, run.key(), page.getRegion(run.start(), run.length()), aggregations);
      }
    }

    Page combined = builder.build();
    log.debug(
        "Combined {} rows into {} groups on key {}",
        page.getPositionCount(),
        combined.getPositionCount(),
        keyColumns);
    return combined;
  }

  private void appendGroup(
      PageBuilder builder,
      GroupKey groupKey,
      Page rows,
      List<? extends AggregateFunction<?, ?>> aggregations) {
    builder.beginRow();
    int channel = 0;
    for (Object value : groupKey.getValues()) {
      builder.setValue(channel++, value);
    }
    for (AggregateFunction<?, ?> aggregation : aggregations) {
      builder.setValue(channel++, accumulate(aggregation, groupKey, rows));
    }
    builder.endRow();
  }

  private static <A> A accumulate(AggregateFunction<A, ?> aggregation, GroupKey key, Page rows) {
    return aggregation.accumulateBlock(aggregation.init(key), rows);
  }
}
