/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Shape and execution statistics describing a page produced by a reduce step. */
@Getter
@ToString
@RequiredArgsConstructor
public class PageMetadata {

  private final int numRows;

  private final long sizeBytes;

  private final List<String> columnNames;

  /** Wall time spent producing the page, in nanoseconds. */
  private final long wallTimeNanos;

  public static PageMetadata of(Page page, long wallTimeNanos) {
    return new PageMetadata(
        page.getPositionCount(),
        page.getRetainedSizeBytes(),
        page.getColumnNames(),
        wallTimeNanos);
  }
}
