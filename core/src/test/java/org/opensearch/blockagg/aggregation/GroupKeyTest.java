/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.Pages;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class GroupKeyTest {

  @Test
  void should_treat_numerically_equal_values_as_same_group() {
    assertEquals(GroupKey.of(1, "a"), GroupKey.of(1L, "a"));
    assertEquals(GroupKey.of(1, "a").hashCode(), GroupKey.of(1.0, "a").hashCode());
    assertNotEquals(GroupKey.of(1, "a"), GroupKey.of(2, "a"));
  }

  @Test
  void should_group_nulls_together() {
    assertEquals(GroupKey.of((Object) null), GroupKey.of((Object) null));
    assertNotEquals(GroupKey.of((Object) null), GroupKey.of(0));
  }

  @Test
  void should_read_key_from_row_and_match_rows() {
    Page page =
        Pages.of(
            List.of("k", "v", "j"),
            new Object[] {"a", 1, 1},
            new Object[] {"a", 2, 1L},
            new Object[] {"b", 3, 1});
    int[] channels = {0, 2};

    GroupKey key = GroupKey.fromRow(page, 0, channels);

    assertEquals(List.of("a", 1), key.getValues());
    assertTrue(key.matches(page, 1, channels));
    assertFalse(key.matches(page, 2, channels));
  }

  @Test
  void should_match_every_row_for_global_key() {
    Page page = Pages.of(List.of("k"), new Object[] {"a"});

    assertTrue(GroupKey.global().isGlobal());
    assertTrue(GroupKey.global().matches(page, 0, new int[0]));
    assertNotEquals(GroupKey.global(), GroupKey.of(List.of()));
  }
}
