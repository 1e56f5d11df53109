/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

/**
 * A column of data within a {@link Page}. Each Block holds values for a single column across all
 * rows in the page.
 */
public interface Block {

  /** Returns the number of values (rows) in this block. */
  int getPositionCount();

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the value, or null if the position is null
   */
  Object getValue(int position);

  /**
   * Returns true if the value at the given position is null.
   *
   * @param position the row index (0-based)
   * @return true if null
   */
  default boolean isNull(int position) {
    return getValue(position) == null;
  }

  /** Returns true if every position of this block is null. An empty block counts as all-null. */
  default boolean isAllNull() {
    for (int i = 0; i < getPositionCount(); i++) {
      if (!isNull(i)) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if at least one position of this block is null. */
  default boolean hasNull() {
    for (int i = 0; i < getPositionCount(); i++) {
      if (isNull(i)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns a sub-region of this block.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Block representing the sub-region
   */
  Block getRegion(int positionOffset, int length);

  /** Copies the values of this block into a new array. */
  default Object[] toArray() {
    Object[] values = new Object[getPositionCount()];
    for (int i = 0; i < values.length; i++) {
      values[i] = getValue(i);
    }
    return values;
  }
}
