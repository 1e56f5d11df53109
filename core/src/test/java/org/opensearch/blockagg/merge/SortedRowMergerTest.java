/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.PageRow;
import org.opensearch.blockagg.page.Pages;
import org.opensearch.blockagg.sort.KeyComparator;
import org.opensearch.blockagg.sort.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortedRowMergerTest {

  private static final List<String> COLUMNS = List.of("k", "tag");

  @Test
  void should_merge_rows_in_key_order_breaking_ties_by_input_order() {
    Page first = Pages.of(COLUMNS, new Object[] {1, "p0"}, new Object[] {3, "p0"});
    Page second = Pages.of(COLUMNS, new Object[] {1, "p1"}, new Object[] {2, "p1"});
    Page third = Pages.of(COLUMNS, new Object[] {3, "p2"}, new Object[] {null, "p2"});

    List<String> merged =
        tags(
            new SortedRowMerger(
                List.of(first, second, third),
                new int[] {0},
                KeyComparator.of(SortKey.ascending("k"))));

    assertEquals(List.of("p0", "p1", "p1", "p0", "p2", "p2"), merged);
  }

  @Test
  void should_skip_empty_pages() {
    Page page = Pages.of(COLUMNS, new Object[] {1, "only"});

    SortedRowMerger merger =
        new SortedRowMerger(
            List.of(Page.empty(COLUMNS), page),
            new int[] {0},
            KeyComparator.of(SortKey.ascending("k")));

    assertEquals(List.of("only"), tags(merger));
    assertFalse(merger.hasNext());
    assertThrows(NoSuchElementException.class, merger::next);
  }

  @Test
  void should_follow_descending_order() {
    Page first = Pages.of(COLUMNS, new Object[] {5, "a"}, new Object[] {1, "b"});
    Page second = Pages.of(COLUMNS, new Object[] {3, "c"});

    List<String> merged =
        tags(
            new SortedRowMerger(
                List.of(first, second),
                new int[] {0},
                KeyComparator.of(SortKey.builder().descending("k").build())));

    assertEquals(List.of("a", "c", "b"), merged);
  }

  private static List<String> tags(SortedRowMerger merger) {
    List<String> tags = new ArrayList<>();
    while (merger.hasNext()) {
      PageRow row = merger.next();
      tags.add(row.getString("tag").orElseThrow());
    }
    return tags;
  }
}
