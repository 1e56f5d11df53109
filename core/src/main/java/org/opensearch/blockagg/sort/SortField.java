/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

/** One column of a {@link SortKey} with its direction. */
public record SortField(String columnName, SortOrder order) {

  public SortField {
    if (columnName == null || columnName.isBlank()) {
      throw new IllegalArgumentException("Sort column name must be non-blank, got: " + columnName);
    }
    if (order == null) {
      throw new IllegalArgumentException("Sort order of column " + columnName + " is null");
    }
  }

  public boolean isDescending() {
    return order == SortOrder.DESCENDING;
  }
}
