/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.opensearch.blockagg.sort.SortField;
import org.opensearch.blockagg.sort.SortKey;

/**
 * The grouping columns of an aggregation: either a {@link Single} column or an ordered {@link
 * Compound} of columns. A global aggregation has no grouping key; APIs taking a {@code
 * GroupingKey} accept null for it.
 */
public interface GroupingKey {

  /** Grouping column names in key order. */
  List<String> getColumnNames();

  static GroupingKey single(String columnName) {
    return new Single(columnName);
  }

  static GroupingKey compound(List<String> columnNames) {
    return new Compound(columnNames);
  }

  /**
   * Resolves a loosely typed key argument at the API boundary.
   *
   * <ul>
   *   <li>{@code null}: global aggregation, returns null
   *   <li>{@link String}: a single column
   *   <li>{@link SortKey}: the sort key columns, directions ignored
   *   <li>{@link List} of {@link String} or {@link SortField}: a compound key
   *   <li>{@link GroupingKey}: returned as is
   * </ul>
   *
   * @throws IllegalArgumentException for any other type, naming it
   */
  static GroupingKey resolve(Object key) {
    if (key == null || key instanceof GroupingKey) {
      return (GroupingKey) key;
    } else if (key instanceof String) {
      return single((String) key);
    } else if (key instanceof SortKey) {
      return compound(((SortKey) key).getColumnNames());
    } else if (key instanceof List) {
      List<String> columns = new ArrayList<>();
      for (Object element : (List<?>) key) {
        if (element instanceof String) {
          columns.add((String) element);
        } else if (element instanceof SortField) {
          columns.add(((SortField) element).columnName());
        } else {
          throw new IllegalArgumentException(
              "key list elements must be column names, but got: "
                  + (element == null ? "null" : element.getClass().getName()));
        }
      }
      return compound(columns);
    }
    throw new IllegalArgumentException(
        "key must be a string, a list of strings or null when aggregating, but got: "
            + key.getClass().getName());
  }

  /** A single grouping column. */
  record Single(String columnName) implements GroupingKey {
    public Single {
      if (columnName == null || columnName.isBlank()) {
        throw new IllegalArgumentException("Grouping column must be non-blank, got: " + columnName);
      }
    }

    @Override
    public List<String> getColumnNames() {
      return List.of(columnName);
    }
  }

  /** An ordered list of grouping columns. */
  record Compound(List<String> columnNames) implements GroupingKey {
    public Compound {
      if (columnNames == null || columnNames.isEmpty()) {
        throw new IllegalArgumentException("Compound grouping key must have at least one column");
      }
      for (String name : columnNames) {
        if (name == null || name.isBlank()) {
          throw new IllegalArgumentException("Grouping column must be non-blank, got: " + name);
        }
      }
      columnNames = ImmutableList.copyOf(columnNames);
    }

    @Override
    public List<String> getColumnNames() {
      return columnNames;
    }
  }
}
