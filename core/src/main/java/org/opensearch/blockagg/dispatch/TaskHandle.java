/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import java.util.concurrent.CompletableFuture;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Handle of a submitted {@link WorkUnit}.
 *
 * @param <T> result type
 */
@RequiredArgsConstructor
public class TaskHandle<T> {

  /** Execution states of a submitted unit. */
  public enum State {
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  @Getter private final String workUnitId;

  @Getter private final CompletableFuture<T> future;

  public State getState() {
    if (future.isCancelled()) {
      return State.CANCELLED;
    } else if (future.isCompletedExceptionally()) {
      return State.FAILED;
    } else if (future.isDone()) {
      return State.FINISHED;
    }
    return State.RUNNING;
  }

  /** Cancels the unit if it has not completed yet. */
  public void cancel() {
    future.cancel(true);
  }
}
