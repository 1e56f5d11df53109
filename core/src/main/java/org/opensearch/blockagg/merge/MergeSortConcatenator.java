/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.merge;

import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.engine.EngineContext;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.page.PageMetadata;
import org.opensearch.blockagg.page.ReducedPage;
import org.opensearch.blockagg.sort.PageSorter;
import org.opensearch.blockagg.sort.SortKey;

/** Reduce step of a distributed sort: concatenates sorted partitions and re-sorts the result. */
@Log4j2
@RequiredArgsConstructor
public class MergeSortConcatenator {

  private final PageSorter pageSorter;

  public MergeSortConcatenator(EngineContext context) {
    this(context.getPageSorter());
  }

  /**
   * Merges pages into one page sorted by {@code sortKey}. Empty pages are skipped; if nothing
   * remains the result is an empty page without columns.
   */
  public ReducedPage mergeSortedPages(List<Page> pages, SortKey sortKey) {
    long startTime = System.nanoTime();
    List<Page> inputs = pages.stream().filter(p -> !p.isEmpty()).collect(Collectors.toList());
    Page merged = inputs.isEmpty() ? Page.empty() : pageSorter.concatAndSort(inputs, sortKey);
    log.debug(
        "Merged {} sorted pages into {} rows by {}",
        inputs.size(),
        merged.getPositionCount(),
        sortKey);
    return new ReducedPage(merged, PageMetadata.of(merged, System.nanoTime() - startTime));
  }
}
