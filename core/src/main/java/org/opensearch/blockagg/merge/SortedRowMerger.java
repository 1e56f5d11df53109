/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.merge;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.PageRow;
import org.opensearch.blockagg.sort.KeyComparator;

/**
 * Streams the rows of several pages, each sorted by the same key, in merged key order. Rows with
 * equal keys are returned in input page order, then in row order within a page.
 *
 * <p>Holds one cursor per non-exhausted page in a heap, so merging n rows from k pages costs
 * O(n log k).
 */
public class SortedRowMerger implements Iterator<PageRow> {

  private final PriorityQueue<Cursor> heap;

  /**
   * @param pages non-empty pages sorted by the key
   * @param keyChannels channels of the key columns, identical in every page
   * @param comparator key comparator matching the pages' sort order
   */
  public SortedRowMerger(List<Page> pages, int[] keyChannels, KeyComparator comparator) {
    Comparator<Cursor> order =
        (left, right) ->
            comparator.compare(
                left.page, keyChannels, left.position, right.page, keyChannels, right.position);
    this.heap =
        new PriorityQueue<>(
            Math.max(1, pages.size()), order.thenComparingInt(cursor -> cursor.source));
    for (int i = 0; i < pages.size(); i++) {
      if (!pages.get(i).isEmpty()) {
        heap.add(new Cursor(pages.get(i), i));
      }
    }
  }

  @Override
  public boolean hasNext() {
    return !heap.isEmpty();
  }

  @Override
  public PageRow next() {
    Cursor cursor = heap.poll();
    if (cursor == null) {
      throw new NoSuchElementException("All pages are exhausted");
    }
    PageRow row = new PageRow(cursor.page, cursor.position);
    cursor.position++;
    if (cursor.position < cursor.page.getPositionCount()) {
      heap.add(cursor);
    }
    return row;
  }

  private static class Cursor {
    private final Page page;
    private final int source;
    private int position;

    Cursor(Page page, int source) {
      this.page = page;
      this.source = source;
    }
  }
}
