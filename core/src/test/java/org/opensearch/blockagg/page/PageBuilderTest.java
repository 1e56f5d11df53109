/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PageBuilderTest {

  @Test
  void should_build_page_row_by_row() {
    PageBuilder builder = new PageBuilder(List.of("key", "count"));

    builder.beginRow();
    builder.setValue(0, "a");
    builder.setValue("count", 3L);
    builder.endRow();
    builder.addRow("b", 5L);

    Page page = builder.build();
    assertEquals(2, page.getPositionCount());
    assertEquals(List.of("key", "count"), page.getColumnNames());
    assertEquals(3L, page.getValue(0, "count"));
    assertEquals("b", page.getValue(1, 0));
  }

  @Test
  void should_default_unset_values_to_null() {
    PageBuilder builder = new PageBuilder(List.of("key", "count"));
    builder.beginRow();
    builder.setValue(0, "a");
    builder.endRow();

    assertNull(builder.build().getValue(0, 1));
  }

  @Test
  void should_reset_after_build() {
    PageBuilder builder = new PageBuilder(List.of("key"));
    builder.addRow("a");

    assertEquals(1, builder.build().getPositionCount());
    assertTrue(builder.isEmpty());
    assertEquals(0, builder.getRowCount());
  }

  @Test
  void should_throw_on_set_or_end_before_begin() {
    PageBuilder builder = new PageBuilder(List.of("key", "count"));
    assertThrows(IllegalStateException.class, () -> builder.setValue(0, "value"));
    assertThrows(IllegalStateException.class, builder::endRow);
  }

  @Test
  void should_throw_on_build_with_uncommitted_row() {
    PageBuilder builder = new PageBuilder(List.of("key"));
    builder.beginRow();
    builder.setValue(0, "value");
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void should_throw_on_invalid_channel_or_column() {
    PageBuilder builder = new PageBuilder(List.of("key", "count"));
    builder.beginRow();
    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(2, "value"));
    assertThrows(IndexOutOfBoundsException.class, () -> builder.setValue(-1, "value"));
    assertThrows(ColumnNotFoundException.class, () -> builder.setValue("sum", 1));
  }

  @Test
  void should_reject_row_of_wrong_width() {
    PageBuilder builder = new PageBuilder(List.of("key", "count"));
    assertThrows(IllegalArgumentException.class, () -> builder.addRow("a"));
  }
}
