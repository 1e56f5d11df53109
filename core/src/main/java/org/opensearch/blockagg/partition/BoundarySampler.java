/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.partition;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.engine.EngineContext;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.Pages;
import org.opensearch.blockagg.sort.PageSorter;
import org.opensearch.blockagg.sort.SortKey;

/**
 * Chooses partition boundaries for a distributed sort: each input page contributes a small random
 * sample of its key columns, and the boundaries are evenly spaced quantiles of the pooled sample.
 */
@Log4j2
@RequiredArgsConstructor
public class BoundarySampler {

  private final PageSorter pageSorter;

  public BoundarySampler(EngineContext context) {
    this(context.getPageSorter());
  }

  /**
   * Samples up to {@code n} rows of the sort key columns without replacement.
   *
   * @param seed random seed, or null for a non-deterministic sample
   * @return a page with the sort key columns; all rows when the page has at most {@code n}
   */
  public Page sample(Page page, int n, SortKey sortKey, Long seed) {
    Preconditions.checkArgument(n >= 0, "Sample size must not be negative: %s", n);
    if (page.isEmpty()) {
      return Page.empty(sortKey.getColumnNames());
    }
    Page keys = Pages.select(page, sortKey.getColumnNames());
    Page shuffled = Pages.randomShuffle(keys, seed);
    return shuffled.getRegion(0, Math.min(n, shuffled.getPositionCount()));
  }

  /**
   * Picks {@code numPartitions - 1} boundaries from pooled samples. Boundary {@code i} is the
   * sample at quantile {@code i / numPartitions} of the sorted pool.
   *
   * @return ordered boundary tuples, one value per sort key column; empty when there are no
   *     sampled rows or a single partition is requested
   */
  public List<List<Object>> sampleBoundaries(
      List<Page> samples, SortKey sortKey, int numPartitions) {
    Preconditions.checkArgument(
        numPartitions > 0, "Number of partitions must be positive: %s", numPartitions);
    List<Page> nonEmpty =
        samples.stream().filter(p -> !p.isEmpty()).collect(Collectors.toList());
    if (nonEmpty.isEmpty() || numPartitions == 1) {
      return List.of();
    }
    Page pooled = pageSorter.concatAndSort(nonEmpty, sortKey);
    Page keys = Pages.select(pooled, sortKey.getColumnNames());
    int size = keys.getPositionCount();
    List<List<Object>> boundaries = new ArrayList<>(numPartitions - 1);
    for (int i = 1; i < numPartitions; i++) {
      int position = Math.min(size - 1, (int) ((long) i * size / numPartitions));
      Object[] values = new Object[keys.getChannelCount()];
      for (int channel = 0; channel < values.length; channel++) {
        values[channel] = keys.getValue(position, channel);
      }
      boundaries.add(Arrays.asList(values));
    }
    log.debug("Sampled {} boundaries from {} rows by {}", boundaries.size(), size, sortKey);
    return boundaries;
  }
}
