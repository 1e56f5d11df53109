/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.merge;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.aggregation.AggregateColumnNames;
import org.opensearch.blockagg.aggregation.AggregateFunction;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.aggregation.GroupingKey;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.PageBuilder;
import org.opensearch.blockagg.page.PageMetadata;
import org.opensearch.blockagg.page.PageRow;
import org.opensearch.blockagg.page.ReducedPage;
import org.opensearch.blockagg.sort.KeyComparator;
import org.opensearch.blockagg.sort.SortKey;
import org.opensearch.blockagg.sort.SortOrder;

/**
 * Reduce phase of a two-phase aggregation: k-way merges pages produced by {@code BlockCombiner}
 * and folds the accumulators of equal keys together.
 */
@Log4j2
public class MergeReducer {

  /** Merges combined pages whose keys are sorted ascending. */
  public ReducedPage aggregateCombinedPages(
      List<Page> pages,
      GroupingKey key,
      List<? extends AggregateFunction<?, ?>> aggregations,
      boolean finalize) {
    SortKey sortKey = key == null ? null : SortKey.ascending(key.getColumnNames());
    return aggregateCombinedPages(pages, key, sortKey, aggregations, finalize);
  }

  /**
   * Merges combined pages.
   *
   * @param pages outputs of the combine phase, each sorted by {@code sortKey}; empty pages are
   *     skipped
   * @param key grouping columns, or null for a global aggregation
   * @param sortKey order of the key columns in the inputs; must name exactly the grouping columns,
   *     ignored for a global aggregation
   * @param aggregations same aggregations, in the same order, as the combine phase
   * @param finalize whether to emit final values instead of merged accumulators
   * @return one row per distinct key in key order, with metadata
   */
  public ReducedPage aggregateCombinedPages(
      List<Page> pages,
      GroupingKey key,
      SortKey sortKey,
      List<? extends AggregateFunction<?, ?>> aggregations,
      boolean finalize) {
    long startTime = System.nanoTime();
    List<String> keyColumns = key == null ? List.of() : key.getColumnNames();
    if (key != null) {
      Preconditions.checkArgument(
          sortKey != null && sortKey.getColumnNames().equals(keyColumns),
          "Sort key %s must match the grouping columns %s",
          sortKey,
          keyColumns);
    }
    List<String> aggregationColumns = AggregateColumnNames.resolve(aggregations);
    List<String> outputColumns =
        ImmutableList.<String>builder().addAll(keyColumns).addAll(aggregationColumns).build();

    List<Page> inputs = pages.stream().filter(p -> !p.isEmpty()).collect(Collectors.toList());
    PageBuilder builder = new PageBuilder(outputColumns);
    if (!inputs.isEmpty()) {
      List<String> inputColumns = inputs.get(0).getColumnNames();
      for (Page page : inputs) {
        Preconditions.checkArgument(
            page.getColumnNames().equals(inputColumns),
            "Combined pages have different columns: %s and %s",
            inputColumns,
            page.getColumnNames());
      }
      Page first = inputs.get(0);
      int[] keyChannels = KeyComparator.channels(first, keyColumns);
      int[] aggregationChannels = KeyComparator.channels(first, aggregationColumns);
      KeyComparator comparator =
          key == null ? new KeyComparator(List.<SortOrder>of()) : KeyComparator.of(sortKey);

      PeekingIterator<PageRow> rows =
          Iterators.peekingIterator(new SortedRowMerger(inputs, keyChannels, comparator));
      while (rows.hasNext()) {
        PageRow row = rows.next();
        GroupKey groupKey =
            key == null
                ? GroupKey.global()
                : GroupKey.fromRow(row.getPage(), row.getPosition(), keyChannels);
        Object[] accumulators = new Object[aggregations.size()];
        for (int i = 0; i < accumulators.length; i++) {
          accumulators[i] = row.getPage().getValue(row.getPosition(), aggregationChannels[i]);
        }
        while (rows.hasNext()
            && groupKey.matches(rows.peek().getPage(), rows.peek().getPosition(), keyChannels)) {
          PageRow next = rows.next();
          for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] =
                merge(
                    aggregations.get(i),
                    accumulators[i],
                    next.getPage().getValue(next.getPosition(), aggregationChannels[i]));
          }
        }
        appendGroup(builder, groupKey, accumulators, aggregations, finalize);
      }
    }

    Page merged = builder.build();
    PageMetadata metadata = PageMetadata.of(merged, System.nanoTime() - startTime);
    log.debug(
        "Merged {} combined pages into {} groups on key {}, finalize={}",
        inputs.size(),
        merged.getPositionCount(),
        keyColumns,
        finalize);
    return new ReducedPage(merged, metadata);
  }

  private void appendGroup(
      PageBuilder builder,
      GroupKey groupKey,
      Object[] accumulators,
      List<? extends AggregateFunction<?, ?>> aggregations,
      boolean finalize) {
    builder.beginRow();
    int channel = 0;
    for (Object value : groupKey.getValues()) {
      builder.setValue(channel++, value);
    }
    for (int i = 0; i < accumulators.length; i++) {
      Object value =
          finalize ? finalizeResult(aggregations.get(i), accumulators[i]) : accumulators[i];
      builder.setValue(channel++, value);
    }
    builder.endRow();
  }

  // Accumulators travel through pages as Object; each aggregation only ever sees its own.
  @SuppressWarnings("unchecked")
  private static <A> Object merge(AggregateFunction<A, ?> aggregation, Object left, Object right) {
    return aggregation.merge((A) left, (A) right);
  }

  @SuppressWarnings("unchecked")
  private static <A> Object finalizeResult(AggregateFunction<A, ?> aggregation, Object value) {
    return aggregation.finalizeResult((A) value);
  }
}
