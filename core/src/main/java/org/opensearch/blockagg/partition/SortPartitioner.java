/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.partition;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.dispatch.TaskDispatcher;
import org.opensearch.blockagg.dispatch.TaskHandle;
import org.opensearch.blockagg.dispatch.WorkUnit;
import org.opensearch.blockagg.engine.EngineContext;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.sort.BoundaryLocator;
import org.opensearch.blockagg.sort.KeyComparator;
import org.opensearch.blockagg.sort.PageSorter;
import org.opensearch.blockagg.sort.SortKey;

/**
 * Map step of a distributed sort: sorts a page and cuts it into contiguous partitions at the
 * given boundaries. Partition {@code i} holds the rows that sort before boundary {@code i} and
 * not before boundary {@code i - 1}, so rows equal to a boundary start the next partition.
 */
@Log4j2
@RequiredArgsConstructor
public class SortPartitioner {

  static final String STAGE_LABEL = "Sort and Partition";

  private final PageSorter pageSorter;

  private final TaskDispatcher taskDispatcher;

  public SortPartitioner(EngineContext context) {
    this(context.getPageSorter(), context.getTaskDispatcher());
  }

  /**
   * Sorts and partitions a page.
   *
   * @param page page to partition
   * @param boundaries ordered boundary tuples, each covering a prefix of the sort key
   * @param sortKey compound sort key
   * @return {@code boundaries.size() + 1} partitions whose concatenation is the sorted page
   * @throws IllegalArgumentException if a boundary has the wrong arity or boundaries are not
   *     ordered by the sort key
   */
  public List<Page> sortAndPartition(
      Page page, List<? extends List<?>> boundaries, SortKey sortKey) {
    validateBoundaries(boundaries, sortKey);
    if (page.isEmpty()) {
      List<Page> partitions = new ArrayList<>(boundaries.size() + 1);
      for (int i = 0; i <= boundaries.size(); i++) {
        partitions.add(page.getRegion(0, 0));
      }
      return partitions;
    }

    Page sorted = pageSorter.sort(page, sortKey);
    if (boundaries.isEmpty()) {
      return ImmutableList.of(sorted);
    }

    List<TaskHandle<Integer>> handles = new ArrayList<>(boundaries.size());
    for (int i = 0; i < boundaries.size(); i++) {
      List<?> boundary = boundaries.get(i);
      handles.add(
          taskDispatcher.submit(
              WorkUnit.of(
                  "boundary-" + i, () -> BoundaryLocator.lowerBound(sorted, sortKey, boundary))));
    }
    List<Integer> bounds = taskDispatcher.gather(STAGE_LABEL, handles);

    List<Page> partitions = new ArrayList<>(bounds.size() + 1);
    int start = 0;
    for (int bound : bounds) {
      Preconditions.checkState(bound >= start, "Boundary index %s precedes %s", bound, start);
      partitions.add(sorted.getRegion(start, bound - start));
      start = bound;
    }
    partitions.add(sorted.getRegion(start, sorted.getPositionCount() - start));
    if (log.isDebugEnabled()) {
      log.debug(
          "Partitioned {} rows by {} into sizes {}",
          sorted.getPositionCount(),
          sortKey,
          partitions.stream().map(Page::getPositionCount).collect(Collectors.toList()));
    }
    return partitions;
  }

  private static void validateBoundaries(List<? extends List<?>> boundaries, SortKey sortKey) {
    KeyComparator comparator = KeyComparator.of(sortKey);
    for (int i = 0; i < boundaries.size(); i++) {
      List<?> boundary = boundaries.get(i);
      Preconditions.checkArgument(
          boundary != null && !boundary.isEmpty() && boundary.size() <= sortKey.size(),
          "Boundary %s must have between 1 and %s values for sort key %s",
          boundary,
          sortKey.size(),
          sortKey);
      if (i > 0) {
        List<?> previous = boundaries.get(i - 1);
        int order = comparator.compareValues(previous, boundary);
        // A shorter tuple tied on the common prefix locates at or before the longer one.
        if (order == 0) {
          order = Integer.compare(previous.size(), boundary.size());
        }
        Preconditions.checkArgument(
            order <= 0,
            "Boundaries must be ordered by %s, but %s comes before %s",
            sortKey,
            previous,
            boundary);
      }
    }
  }
}
