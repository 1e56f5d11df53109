/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import java.util.Arrays;
import org.opensearch.blockagg.common.setting.Settings;
import org.opensearch.blockagg.page.Page;

/**
 * Sort backend for large pages. Uses the stable parallel merge sort of {@link
 * Arrays#parallelSort(Object[], java.util.Comparator)} on the common fork-join pool.
 */
public class ParallelPageSorter implements PageSorter {

  public static final String NAME = "parallel";

  @Override
  public int[] sortIndices(Page page, SortKey sortKey) {
    int[] channels = KeyComparator.channels(page, sortKey);
    Integer[] positions = DefaultPageSorter.positions(page);
    Arrays.parallelSort(positions, KeyComparator.of(sortKey).positionComparator(page, channels));
    return Arrays.stream(positions).mapToInt(Integer::intValue).toArray();
  }

  /** Registers the parallel backend. */
  public static class Provider implements PageSorterProvider {
    @Override
    public String getName() {
      return NAME;
    }

    @Override
    public PageSorter create(Settings settings) {
      return new ParallelPageSorter();
    }
  }
}
