/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import java.util.List;
import lombok.Getter;
import org.opensearch.blockagg.common.exception.BlockAggregationException;

/** Thrown when a page is asked for a column it does not have. */
@Getter
public class ColumnNotFoundException extends BlockAggregationException {

  private final String columnName;

  public ColumnNotFoundException(String columnName, List<String> availableColumns) {
    super(
        String.format(
            "Column [%s] does not exist, available columns are %s", columnName, availableColumns));
    this.columnName = columnName;
  }
}
