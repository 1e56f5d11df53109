/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import lombok.experimental.UtilityClass;

/** Table operations over {@link Page}s: construction, projection, concatenation and reordering. */
@UtilityClass
public class Pages {

  /** Builds a page from literal rows, values in column order. */
  public static Page of(List<String> columnNames, Object[]... rows) {
    PageBuilder builder = new PageBuilder(columnNames);
    for (Object[] row : rows) {
      builder.addRow(row);
    }
    return builder.build();
  }

  /**
   * Returns a page containing only the given columns, in the given order.
   *
   * @throws IllegalArgumentException if a column name is null or blank
   * @throws ColumnNotFoundException if a column does not exist
   */
  public static Page select(Page page, List<String> columnNames) {
    int[] channels = new int[columnNames.size()];
    for (int i = 0; i < channels.length; i++) {
      String name = columnNames.get(i);
      Preconditions.checkArgument(
          name != null && !name.isBlank(), "Column names must be non-blank, got [%s]", name);
      channels[i] = page.getChannel(name);
    }
    Object[][] rows = new Object[page.getPositionCount()][];
    for (int position = 0; position < rows.length; position++) {
      Object[] row = new Object[channels.length];
      for (int i = 0; i < channels.length; i++) {
        row[i] = page.getValue(position, channels[i]);
      }
      rows[position] = row;
    }
    return new RowPage(columnNames, rows);
  }

  /** Returns a page holding the rows at the given positions, in that order. */
  public static Page take(Page page, int[] positions) {
    Object[][] rows = new Object[positions.length][];
    for (int i = 0; i < positions.length; i++) {
      rows[i] = rowValues(page, positions[i]);
    }
    return new RowPage(page.getColumnNames(), rows);
  }

  /**
   * Returns the rows of the page in random order.
   *
   * @param seed random seed, or null for a non-deterministic shuffle
   */
  public static Page randomShuffle(Page page, Long seed) {
    List<Integer> order = new ArrayList<>(page.getPositionCount());
    for (int i = 0; i < page.getPositionCount(); i++) {
      order.add(i);
    }
    Collections.shuffle(order, seed == null ? new Random() : new Random(seed));
    return take(page, order.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Concatenates pages with identical schemas. Empty pages without a schema are skipped, and an
   * empty input list yields {@link Page#empty()}.
   *
   * @throws IllegalArgumentException if the pages have different columns
   */
  public static Page concat(List<Page> pages) {
    List<Page> nonEmpty = new ArrayList<>();
    List<String> columnNames = null;
    for (Page page : pages) {
      if (page.getChannelCount() == 0 && page.isEmpty()) {
        continue;
      }
      if (columnNames == null) {
        columnNames = page.getColumnNames();
      } else if (!columnNames.equals(page.getColumnNames())) {
        throw new IllegalArgumentException(
            String.format(
                "Cannot concatenate pages with different columns: %s and %s",
                columnNames, page.getColumnNames()));
      }
      nonEmpty.add(page);
    }
    if (columnNames == null) {
      return Page.empty();
    }
    if (nonEmpty.size() == 1) {
      return nonEmpty.get(0);
    }
    int total = nonEmpty.stream().mapToInt(Page::getPositionCount).sum();
    Object[][] rows = new Object[total][];
    int next = 0;
    for (Page page : nonEmpty) {
      for (int position = 0; position < page.getPositionCount(); position++) {
        rows[next++] = rowValues(page, position);
      }
    }
    return new RowPage(columnNames, rows);
  }

  /**
   * Places the columns of two pages with the same row count side by side. Columns of the right
   * page whose names collide with the left page are suffixed with {@code _1}, {@code _2}, ...
   */
  public static Page zip(Page left, Page right) {
    Preconditions.checkArgument(
        left.getPositionCount() == right.getPositionCount(),
        "Cannot zip pages with different row counts: %s and %s",
        left.getPositionCount(),
        right.getPositionCount());
    List<String> names = new ArrayList<>(left.getColumnNames());
    for (String name : right.getColumnNames()) {
      String candidate = name;
      int suffix = 1;
      while (names.contains(candidate)) {
        candidate = name + "_" + suffix++;
      }
      names.add(candidate);
    }
    Object[][] rows = new Object[left.getPositionCount()][];
    for (int position = 0; position < rows.length; position++) {
      Object[] row = new Object[names.size()];
      for (int i = 0; i < left.getChannelCount(); i++) {
        row[i] = left.getValue(position, i);
      }
      for (int i = 0; i < right.getChannelCount(); i++) {
        row[left.getChannelCount() + i] = right.getValue(position, i);
      }
      rows[position] = row;
    }
    return new RowPage(ImmutableList.copyOf(names), rows);
  }

  /** Returns every row of the page as a list of value lists. Mostly useful for assertions. */
  public static List<List<Object>> toRows(Page page) {
    List<List<Object>> rows = new ArrayList<>(page.getPositionCount());
    for (int position = 0; position < page.getPositionCount(); position++) {
      rows.add(Arrays.asList(rowValues(page, position)));
    }
    return rows;
  }

  private static Object[] rowValues(Page page, int position) {
    Object[] row = new Object[page.getChannelCount()];
    for (int channel = 0; channel < row.length; channel++) {
      row[channel] = page.getValue(position, channel);
    }
    return row;
  }
}
