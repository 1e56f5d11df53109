/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import java.util.List;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.Pages;

/**
 * Sort backend. Implementations must be stable: rows with equal keys keep their input order.
 * Sorting a page that lacks a key column fails with {@code ColumnNotFoundException}, so callers
 * skip empty, schema-less pages before sorting.
 */
public interface PageSorter {

  /**
   * Returns the row positions of the page in sorted order.
   *
   * @param page the page to sort
   * @param sortKey compound sort key
   * @return positions such that {@code take(page, positions)} is sorted
   */
  int[] sortIndices(Page page, SortKey sortKey);

  /** Returns a sorted copy of the page. */
  default Page sort(Page page, SortKey sortKey) {
    return Pages.take(page, sortIndices(page, sortKey));
  }

  /** Concatenates the pages and sorts the result. */
  default Page concatAndSort(List<Page> pages, SortKey sortKey) {
    return sort(Pages.concat(pages), sortKey);
  }
}
