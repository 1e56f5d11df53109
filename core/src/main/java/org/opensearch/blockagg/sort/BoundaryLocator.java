/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.opensearch.blockagg.page.Page;

/**
 * Compound-key binary search over a page sorted by a {@link SortKey}.
 *
 * <p>The search keeps a row window {@code [left, right)}, initially the whole page. For each
 * boundary value, in sort key order, it finds the leftmost and rightmost positions of that value
 * inside the window using the column's own direction; those positions become the window for the
 * next column. After the last supplied value the window holds exactly the rows equal to the
 * boundary on the searched prefix, so its left edge is the lower bound and its right edge the
 * upper bound of the boundary in the page.
 *
 * <p>Each step is O(log n), a full search is O(k log n) for k key columns.
 */
@UtilityClass
public class BoundaryLocator {

  /** Which edge of the run of equal keys to return. */
  public enum Side {
    /** Rows before the returned index compare strictly less than the boundary. */
    LEFT,
    /** Rows before the returned index compare less than or equal to the boundary. */
    RIGHT
  }

  public static int lowerBound(Page sorted, SortKey sortKey, List<?> boundary) {
    return locate(sorted, sortKey, boundary, Side.LEFT);
  }

  public static int upperBound(Page sorted, SortKey sortKey, List<?> boundary) {
    return locate(sorted, sortKey, boundary, Side.RIGHT);
  }

  /**
   * Returns the index at which the boundary would be inserted into the sorted page.
   *
   * @param sorted page sorted by {@code sortKey}
   * @param sortKey the sort key the page was sorted with
   * @param boundary one value per leading sort key column; a shorter tuple searches a prefix
   * @param side lower or upper bound
   * @return insertion index in {@code [0, sorted.getPositionCount()]}
   * @throws IllegalArgumentException if the boundary is empty or longer than the sort key
   */
  public static int locate(Page sorted, SortKey sortKey, List<?> boundary, Side side) {
    Preconditions.checkArgument(
        !boundary.isEmpty() && boundary.size() <= sortKey.size(),
        "Boundary %s must have between 1 and %s values for sort key %s",
        boundary,
        sortKey.size(),
        sortKey);

    int left = 0;
    int right = sorted.getPositionCount();
    for (int i = 0; i < boundary.size() && left < right; i++) {
      SortField field = sortKey.get(i);
      int channel = sorted.getChannel(field.columnName());
      Object desired = boundary.get(i);
      int lower = search(sorted, channel, left, right, desired, field.order(), false);
      int upper = search(sorted, channel, lower, right, desired, field.order(), true);
      left = lower;
      right = upper;
    }
    return side == Side.LEFT ? left : right;
  }

  /**
   * Returns the first position in {@code [from, to)} whose value compares greater than or equal to
   * {@code desired} (strictly greater when {@code strict}), or {@code to} if there is none.
   */
  private static int search(
      Page page, int channel, int from, int to, Object desired, SortOrder order, boolean strict) {
    int low = from;
    int high = to;
    while (low < high) {
      int mid = (low + high) >>> 1;
      int cmp = ValueComparator.compare(page.getValue(mid, channel), desired, order);
      if (cmp < 0 || (strict && cmp == 0)) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
