/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import java.util.Locale;

/** Direction of one sort column. */
public enum SortOrder {
  ASCENDING,
  DESCENDING;

  /**
   * Parses {@code "ascending"} or {@code "descending"}, case insensitive.
   *
   * @throws IllegalArgumentException for any other value
   */
  public static SortOrder fromString(String order) {
    if (order != null) {
      switch (order.toLowerCase(Locale.ROOT)) {
        case "ascending":
          return ASCENDING;
        case "descending":
          return DESCENDING;
        default:
          break;
      }
    }
    throw new IllegalArgumentException(
        "Sort order must be \"ascending\" or \"descending\", got: " + order);
  }
}
