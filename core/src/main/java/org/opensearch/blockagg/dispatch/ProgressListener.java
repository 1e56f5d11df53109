/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

/**
 * Observes the completion of dispatched work. Notifications may arrive on worker threads and in any
 * order; they are advisory and never influence results.
 */
public interface ProgressListener {

  /** Listener that ignores every notification. */
  ProgressListener NO_OP = new ProgressListener() {};

  /** Called once before the units of a named batch are awaited. */
  default void onStart(String label, int total) {}

  /** Called each time a unit of the batch completes, successfully or not. */
  default void onProgress(String label, int completed, int total) {}

  /** Called once all units of the batch completed successfully. */
  default void onFinish(String label, int total) {}
}
