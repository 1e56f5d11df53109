/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;

/**
 * Row-based {@link Page} implementation. Each row is an Object array where the index corresponds
 * to the column (channel) position. Regions are views over the same row array, so slicing a page
 * never copies rows.
 */
public class RowPage implements Page {

  private final List<String> columnNames;
  private final Object[][] rows;
  private final int offset;
  private final int length;

  /**
   * Creates a RowPage from pre-built row data. The rows array is not copied and must not be
   * modified afterwards.
   *
   * @param columnNames the column names, in channel order
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   */
  public RowPage(List<String> columnNames, Object[][] rows) {
    this(ImmutableList.copyOf(columnNames), rows, 0, rows.length);
    if (new HashSet<>(columnNames).size() != columnNames.size()) {
      throw new IllegalArgumentException("Duplicate column names: " + columnNames);
    }
    for (int i = 0; i < rows.length; i++) {
      if (rows[i].length != columnNames.size()) {
        throw new IllegalArgumentException(
            String.format(
                "Row %d has %d values, expected %d", i, rows[i].length, columnNames.size()));
      }
    }
  }

  private RowPage(List<String> columnNames, Object[][] rows, int offset, int length) {
    this.columnNames = columnNames;
    this.rows = rows;
    this.offset = offset;
    this.length = length;
  }

  @Override
  public int getPositionCount() {
    return length;
  }

  @Override
  public int getChannelCount() {
    return columnNames.size();
  }

  @Override
  public List<String> getColumnNames() {
    return columnNames;
  }

  @Override
  public Object getValue(int position, int channel) {
    if (position < 0 || position >= length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + length + ")");
    }
    if (channel < 0 || channel >= columnNames.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + columnNames.size() + ")");
    }
    return rows[offset + position][channel];
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > this.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + this.length
              + ")");
    }
    return new RowPage(columnNames, rows, offset + positionOffset, length);
  }

  @Override
  public Block getBlock(int channel) {
    if (channel < 0 || channel >= columnNames.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + columnNames.size() + ")");
    }
    Object[] values = new Object[length];
    for (int i = 0; i < length; i++) {
      values[i] = rows[offset + i][channel];
    }
    return new ArrayBlock(values);
  }

  /** Returns a copy of the row at the given position. */
  public Object[] getRow(int position) {
    if (position < 0 || position >= length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + length + ")");
    }
    return rows[offset + position].clone();
  }

  @Override
  public String toString() {
    return "RowPage{columns=" + columnNames + ", positions=" + length + "}";
  }
}
