/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Page} row by row. Call {@link #beginRow()}, set values via {@link #setValue(int,
 * Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the final Page.
 */
public class PageBuilder {

  private final List<String> columnNames;
  private final List<Object[]> rows;
  private Object[] currentRow;

  public PageBuilder(List<String> columnNames) {
    this.columnNames = ImmutableList.copyOf(columnNames);
    this.rows = new ArrayList<>();
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[columnNames.size()];
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= columnNames.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + columnNames.size() + ")");
    }
    currentRow[channel] = value;
  }

  /** Sets the value of the named column in the current row. */
  public void setValue(String columnName, Object value) {
    int channel = columnNames.indexOf(columnName);
    if (channel < 0) {
      throw new ColumnNotFoundException(columnName, columnNames);
    }
    setValue(channel, value);
  }

  /** Commits the current row to the page. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    rows.add(currentRow);
    currentRow = null;
  }

  /** Appends a complete row, values in channel order. */
  public PageBuilder addRow(Object... values) {
    if (values.length != columnNames.size()) {
      throw new IllegalArgumentException(
          String.format("Expected %d values, got %d", columnNames.size(), values.length));
    }
    beginRow();
    System.arraycopy(values, 0, currentRow, 0, values.length);
    endRow();
    return this;
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  /** Builds the final Page from all committed rows and resets the builder. */
  public Page build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    Object[][] data = rows.toArray(new Object[0][]);
    rows.clear();
    return new RowPage(columnNames, data);
  }
}
