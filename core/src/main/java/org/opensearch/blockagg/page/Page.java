/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import java.util.List;

/**
 * An immutable table of named columns sharing a single row count. Pages are produced by {@link
 * PageBuilder} or the {@link Pages} helpers and are never modified once built; every transformation
 * returns a new page (or a zero-copy view of an existing one).
 *
 * <p>A page may carry the contract "sorted by key K" established by whichever component produced
 * it. Consumers trust that contract and do not verify it.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /** Returns the column names, in channel order. */
  List<String> getColumnNames();

  /**
   * Returns the channel of the named column.
   *
   * @param columnName the column name
   * @return the column index (0-based)
   * @throws ColumnNotFoundException if the page has no such column
   */
  default int getChannel(String columnName) {
    int channel = getColumnNames().indexOf(columnName);
    if (channel < 0) {
      throw new ColumnNotFoundException(columnName, getColumnNames());
    }
    return channel;
  }

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int position, int channel);

  /** Returns the value at the given row of the named column. */
  default Object getValue(int position, String columnName) {
    return getValue(position, getChannel(columnName));
  }

  /**
   * Returns a sub-region of this page. Implementations share the underlying data.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /**
   * Returns the columnar block for the given channel.
   *
   * @param channel the column index (0-based)
   * @return the block for the channel
   */
  Block getBlock(int channel);

  /** Returns the columnar block of the named column. */
  default Block getBlock(String columnName) {
    return getBlock(getChannel(columnName));
  }

  /** Returns true if this page has no rows. */
  default boolean isEmpty() {
    return getPositionCount() == 0;
  }

  /**
   * Returns the estimated memory retained by this page in bytes. Default implementation estimates
   * based on position count, channel count, and 8 bytes per value.
   */
  default long getRetainedSizeBytes() {
    return (long) getPositionCount() * getChannelCount() * 8L;
  }

  /** Returns an empty page with zero rows and no schema. */
  static Page empty() {
    return empty(List.of());
  }

  /** Returns an empty page with zero rows and the given columns. */
  static Page empty(List<String> columnNames) {
    return new RowPage(columnNames, new Object[0][]);
  }
}
