/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.log4j.Log4j2;

/** {@link TaskDispatcher} running work units on an {@link ExecutorService}. */
@Log4j2
public class ExecutorTaskDispatcher implements TaskDispatcher {

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ExecutorService executor;
  private final ProgressListener progressListener;

  public ExecutorTaskDispatcher(ExecutorService executor, ProgressListener progressListener) {
    this.executor = executor;
    this.progressListener = progressListener;
  }

  /** Dispatcher backed by a fixed pool of daemon threads. */
  public static ExecutorTaskDispatcher fixed(int parallelism, ProgressListener progressListener) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            parallelism,
            new ThreadFactoryBuilder()
                .setNameFormat("blockagg-dispatch-%d")
                .setDaemon(true)
                .build());
    return new ExecutorTaskDispatcher(executor, progressListener);
  }

  /** Dispatcher that runs every unit on the submitting thread. */
  public static ExecutorTaskDispatcher direct() {
    return new ExecutorTaskDispatcher(
        MoreExecutors.newDirectExecutorService(), ProgressListener.NO_OP);
  }

  @Override
  public <T> TaskHandle<T> submit(WorkUnit<T> workUnit) {
    CompletableFuture<T> future =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return workUnit.getTask().call();
              } catch (RuntimeException e) {
                throw e;
              } catch (Exception e) {
                throw new CompletionException(e);
              }
            },
            executor);
    return new TaskHandle<>(workUnit.getWorkUnitId(), future);
  }

  @Override
  public <T> List<T> gather(String label, List<TaskHandle<T>> handles) {
    int total = handles.size();
    progressListener.onStart(label, total);
    AtomicInteger completed = new AtomicInteger();
    for (TaskHandle<T> handle : handles) {
      handle
          .getFuture()
          .whenComplete(
              (result, error) ->
                  progressListener.onProgress(label, completed.incrementAndGet(), total));
    }

    List<T> results = new ArrayList<>(total);
    for (TaskHandle<T> handle : handles) {
      try {
        results.add(handle.getFuture().get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancelAll(handles);
        throw new TaskExecutionException(handle.getWorkUnitId(), e);
      } catch (ExecutionException | CancellationException e) {
        cancelAll(handles);
        Throwable cause = e instanceof ExecutionException ? unwrap(e.getCause()) : e;
        log.error("{}: work unit {} failed", label, handle.getWorkUnitId(), cause);
        throw new TaskExecutionException(handle.getWorkUnitId(), cause);
      }
    }
    progressListener.onFinish(label, total);
    return results;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Dispatcher did not terminate in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static <T> void cancelAll(List<TaskHandle<T>> handles) {
    handles.forEach(TaskHandle::cancel);
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
