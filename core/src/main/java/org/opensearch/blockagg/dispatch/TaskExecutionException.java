/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import lombok.Getter;
import org.opensearch.blockagg.common.exception.BlockAggregationException;

/** A dispatched work unit failed, so the whole dispatching call failed. */
@Getter
public class TaskExecutionException extends BlockAggregationException {

  private final String workUnitId;

  public TaskExecutionException(String workUnitId, Throwable cause) {
    super(String.format("Work unit [%s] failed: %s", workUnitId, cause.getMessage()), cause);
    this.workUnitId = workUnitId;
  }
}
