/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.combine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.Pages;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GroupRunIteratorTest {

  @Test
  void should_split_sorted_page_into_runs_of_equal_keys() {
    Page page =
        Pages.of(
            List.of("k", "v"),
            new Object[] {"a", 1},
            new Object[] {"a", 2},
            new Object[] {"b", 5},
            new Object[] {null, 6},
            new Object[] {null, 7});

    List<GroupRun> runs = collect(new GroupRunIterator(page, new int[] {0}));

    assertEquals(
        List.of(
            new GroupRun(GroupKey.of("a"), 0, 2),
            new GroupRun(GroupKey.of("b"), 2, 3),
            new GroupRun(GroupKey.of((Object) null), 3, 5)),
        runs);
  }

  @Test
  void should_group_on_compound_key_and_numeric_equality() {
    Page page =
        Pages.of(
            List.of("a", "b"),
            new Object[] {1, 1},
            new Object[] {1L, 1.0},
            new Object[] {1, 2},
            new Object[] {2, 2});

    List<GroupRun> runs = collect(new GroupRunIterator(page, new int[] {0, 1}));

    assertEquals(3, runs.size());
    assertEquals(2, runs.get(0).length());
    assertEquals(GroupKey.of(2, 2), runs.get(2).key());
  }

  @Test
  void should_end_in_exhausted_state() {
    GroupRunIterator iterator =
        new GroupRunIterator(Pages.of(List.of("k"), new Object[] {"a"}), new int[] {0});

    assertEquals(GroupRunIterator.State.AWAITING_ROW, iterator.getState());
    iterator.next();
    assertFalse(iterator.hasNext());
    assertEquals(GroupRunIterator.State.EXHAUSTED, iterator.getState());
    assertThrows(NoSuchElementException.class, iterator::next);
  }

  @Test
  void should_yield_nothing_for_empty_page() {
    assertFalse(new GroupRunIterator(Page.empty(List.of("k")), new int[] {0}).hasNext());
  }

  private static List<GroupRun> collect(GroupRunIterator iterator) {
    List<GroupRun> runs = new ArrayList<>();
    iterator.forEachRemaining(runs::add);
    return runs;
  }
}
