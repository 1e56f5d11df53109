/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import java.util.concurrent.Callable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * An independent unit of work submitted to a {@link TaskDispatcher}. Work units must not share
 * mutable state with each other; their inputs are immutable pages and values.
 *
 * @param <T> result type
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WorkUnit<T> {

  /** Unique identifier for tracking and error reporting */
  @ToString.Include @EqualsAndHashCode.Include private final String workUnitId;

  /** The computation to run */
  private final Callable<T> task;

  /**
   * Creates a work unit.
   *
   * @param workUnitId unique identifier
   * @param task computation
   * @return work unit
   */
  public static <T> WorkUnit<T> of(String workUnitId, Callable<T> task) {
    return new WorkUnit<>(workUnitId, task);
  }
}
