/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.opensearch.blockagg.page.Page;

/**
 * Compares rows by a compound key. Key columns are addressed by channel, so rows of different
 * pages can be compared as long as each side supplies its own channels for the same key.
 */
public class KeyComparator {

  private final List<SortOrder> orders;

  public KeyComparator(List<SortOrder> orders) {
    this.orders = ImmutableList.copyOf(orders);
  }

  public static KeyComparator of(SortKey sortKey) {
    return new KeyComparator(
        sortKey.getFields().stream().map(SortField::order).collect(Collectors.toList()));
  }

  /** Resolves the channels of the sort key columns in the given page. */
  public static int[] channels(Page page, SortKey sortKey) {
    return channels(page, sortKey.getColumnNames());
  }

  /** Resolves the channels of the given columns in the given page. */
  public static int[] channels(Page page, List<String> columnNames) {
    int[] channels = new int[columnNames.size()];
    for (int i = 0; i < channels.length; i++) {
      channels[i] = page.getChannel(columnNames.get(i));
    }
    return channels;
  }

  public int compare(
      Page left,
      int[] leftChannels,
      int leftPosition,
      Page right,
      int[] rightChannels,
      int rightPosition) {
    for (int i = 0; i < orders.size(); i++) {
      int result =
          ValueComparator.compare(
              left.getValue(leftPosition, leftChannels[i]),
              right.getValue(rightPosition, rightChannels[i]),
              orders.get(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  /**
   * Compares two key tuples value by value. Tuples may be shorter than the key; only the common
   * prefix is compared.
   */
  public int compareValues(List<?> left, List<?> right) {
    int length = Math.min(Math.min(left.size(), right.size()), orders.size());
    for (int i = 0; i < length; i++) {
      int result = ValueComparator.compare(left.get(i), right.get(i), orders.get(i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  /** Orders positions of a single page. */
  public Comparator<Integer> positionComparator(Page page, int[] channels) {
    return (left, right) -> compare(page, channels, left, page, channels, right);
  }
}
