/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.partition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.Pages;
import org.opensearch.blockagg.sort.DefaultPageSorter;
import org.opensearch.blockagg.sort.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BoundarySamplerTest {

  private static final SortKey BY_V = SortKey.ascending("v");

  private final BoundarySampler sampler = new BoundarySampler(new DefaultPageSorter());

  @Test
  void should_sample_distinct_rows_of_key_columns() {
    Page page = range(0, 50);

    Page sample = sampler.sample(page, 10, BY_V, 1L);

    assertEquals(List.of("v"), sample.getColumnNames());
    assertEquals(10, sample.getPositionCount());
    Set<Object> distinct = new HashSet<>();
    Pages.toRows(sample).forEach(row -> distinct.add(row.get(0)));
    assertEquals(10, distinct.size());
    assertEquals(Pages.toRows(sample), Pages.toRows(sampler.sample(page, 10, BY_V, 1L)));
  }

  @Test
  void should_return_every_row_when_sample_exceeds_page() {
    assertEquals(5, sampler.sample(range(0, 5), 10, BY_V, null).getPositionCount());
    assertTrue(sampler.sample(Page.empty(), 10, BY_V, 1L).isEmpty());
    assertThrows(IllegalArgumentException.class, () -> sampler.sample(range(0, 5), -1, BY_V, 1L));
  }

  @Test
  void should_pick_evenly_spaced_quantiles() {
    List<Page> samples = List.of(range(50, 75), range(0, 25), range(75, 100), range(25, 50));

    List<List<Object>> boundaries = sampler.sampleBoundaries(samples, BY_V, 4);

    assertEquals(List.of(List.of(25), List.of(50), List.of(75)), boundaries);
  }

  @Test
  void should_follow_sort_direction() {
    SortKey descending = SortKey.builder().descending("v").build();

    assertEquals(
        List.of(List.of(4)), sampler.sampleBoundaries(List.of(range(0, 10)), descending, 2));
  }

  @Test
  void should_return_no_boundaries_without_samples_or_for_one_partition() {
    assertEquals(List.of(), sampler.sampleBoundaries(List.of(Page.empty()), BY_V, 4));
    assertEquals(List.of(), sampler.sampleBoundaries(List.of(range(0, 10)), BY_V, 1));
    assertThrows(
        IllegalArgumentException.class,
        () -> sampler.sampleBoundaries(List.of(range(0, 10)), BY_V, 0));
  }

  private static Page range(int from, int to) {
    List<Object[]> rows = new ArrayList<>();
    for (int i = from; i < to; i++) {
      rows.add(new Object[] {i, "row-" + i});
    }
    return Pages.of(List.of("v", "label"), rows.toArray(new Object[0][]));
  }
}
