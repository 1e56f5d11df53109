/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.common.exception;

/** Base class for failures raised by the block aggregation engine. */
public class BlockAggregationException extends RuntimeException {

  public BlockAggregationException(String message) {
    super(message);
  }

  public BlockAggregationException(String message, Throwable cause) {
    super(message, cause);
  }
}
