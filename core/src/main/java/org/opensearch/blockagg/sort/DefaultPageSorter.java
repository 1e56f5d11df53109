/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import java.util.Arrays;
import org.opensearch.blockagg.common.setting.Settings;
import org.opensearch.blockagg.page.Page;

/** Single threaded sort backend using a stable merge sort over row positions. */
public class DefaultPageSorter implements PageSorter {

  public static final String NAME = "default";

  @Override
  public int[] sortIndices(Page page, SortKey sortKey) {
    int[] channels = KeyComparator.channels(page, sortKey);
    Integer[] positions = positions(page);
    Arrays.sort(positions, KeyComparator.of(sortKey).positionComparator(page, channels));
    return Arrays.stream(positions).mapToInt(Integer::intValue).toArray();
  }

  static Integer[] positions(Page page) {
    Integer[] positions = new Integer[page.getPositionCount()];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = i;
    }
    return positions;
  }

  /** Registers the default backend. */
  public static class Provider implements PageSorterProvider {
    @Override
    public String getName() {
      return NAME;
    }

    @Override
    public PageSorter create(Settings settings) {
      return new DefaultPageSorter();
    }
  }
}
