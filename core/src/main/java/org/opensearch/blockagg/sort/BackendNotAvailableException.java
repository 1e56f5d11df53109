/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import org.opensearch.blockagg.common.exception.BlockAggregationException;

/** Raised when the configured sort backend has no provider on the class path. */
public class BackendNotAvailableException extends BlockAggregationException {

  public BackendNotAvailableException(String message) {
    super(message);
  }
}
