/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import java.util.List;

/**
 * Runs independent units of work, possibly in parallel. Submission must be safe from concurrent
 * callers.
 */
public interface TaskDispatcher extends AutoCloseable {

  /**
   * Schedules a unit of work and returns immediately.
   *
   * @param workUnit the unit to run
   * @return handle of the running unit
   */
  <T> TaskHandle<T> submit(WorkUnit<T> workUnit);

  /**
   * Waits for all units and returns their results in the order of {@code handles}, regardless of
   * completion order. If any unit fails, the remaining units are cancelled and the failure is
   * raised; no partial result is returned.
   *
   * @param label batch name used for progress reporting
   * @param handles handles returned by {@link #submit(WorkUnit)}
   * @return results in handle order
   * @throws TaskExecutionException if any unit failed
   */
  <T> List<T> gather(String label, List<TaskHandle<T>> handles);

  /** Releases the worker threads. */
  @Override
  void close();
}
