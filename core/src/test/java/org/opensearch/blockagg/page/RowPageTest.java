/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowPageTest {

  private static final List<String> COLUMNS = List.of("name", "age");

  @Test
  void should_access_values_by_channel_and_column_name() {
    Object[][] data = {
      {"Alice", 30},
      {"Bob", 25}
    };
    RowPage page = new RowPage(COLUMNS, data);

    assertEquals(2, page.getPositionCount());
    assertEquals(2, page.getChannelCount());
    assertEquals("Alice", page.getValue(0, 0));
    assertEquals(25, page.getValue(1, "age"));
    assertEquals(1, page.getChannel("age"));
  }

  @Test
  void should_handle_null_values() {
    RowPage page = new RowPage(COLUMNS, new Object[][] {{null, 30}});

    assertNull(page.getValue(0, 0));
    assertTrue(page.getBlock("name").isNull(0));
  }

  @Test
  void should_share_rows_between_nested_regions() {
    Object[][] data = {
      {"Alice", 30},
      {"Bob", 25},
      {"Charlie", 35},
      {"Diana", 28}
    };
    RowPage page = new RowPage(COLUMNS, data);

    Page region = page.getRegion(1, 3).getRegion(1, 2);
    assertEquals(2, region.getPositionCount());
    assertEquals("Charlie", region.getValue(0, 0));
    assertEquals("Diana", region.getValue(1, 0));
    assertArrayEquals(new Object[] {35, 28}, region.getBlock("age").toArray());
  }

  @Test
  void should_report_null_layout_of_blocks() {
    RowPage page = new RowPage(COLUMNS, new Object[][] {{null, 30}, {null, null}});

    assertTrue(page.getBlock("name").isAllNull());
    assertTrue(page.getBlock("age").hasNull());
    assertFalse(page.getBlock("age").isAllNull());
    assertFalse(page.getBlock("age").getRegion(0, 1).hasNull());
  }

  @Test
  void should_estimate_retained_size_from_cell_count() {
    RowPage page = new RowPage(COLUMNS, new Object[][] {{"Alice", 30}, {"Bob", 25}});

    assertEquals(32L, page.getRetainedSizeBytes());
    assertEquals(16L, page.getRegion(1, 1).getRetainedSizeBytes());
  }

  @Test
  void should_create_empty_page_with_and_without_schema() {
    Page empty = Page.empty(COLUMNS);
    assertEquals(0, empty.getPositionCount());
    assertEquals(2, empty.getChannelCount());

    Page schemaless = Page.empty();
    assertTrue(schemaless.isEmpty());
    assertEquals(0, schemaless.getChannelCount());
  }

  @Test
  void should_throw_on_unknown_column() {
    RowPage page = new RowPage(COLUMNS, new Object[][] {{"Alice", 30}});

    ColumnNotFoundException e =
        assertThrows(ColumnNotFoundException.class, () -> page.getValue(0, "salary"));
    assertEquals("salary", e.getColumnName());
  }

  @Test
  void should_throw_on_invalid_position_or_channel() {
    RowPage page = new RowPage(COLUMNS, new Object[][] {{"Alice", 30}});

    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(-1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(0, 2));
  }

  @Test
  void should_throw_on_invalid_region() {
    RowPage page = new RowPage(List.of("name"), new Object[][] {{"Alice"}, {"Bob"}});

    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(1, 3));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(-1, 1));
  }

  @Test
  void should_reject_duplicate_columns_and_ragged_rows() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new RowPage(List.of("a", "a"), new Object[][] {{1, 2}}));
    assertThrows(
        IllegalArgumentException.class, () -> new RowPage(COLUMNS, new Object[][] {{"Alice"}}));
  }
}
