/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.google.common.util.concurrent.MoreExecutors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutorTaskDispatcherTest {

  @Mock private ProgressListener progressListener;

  private final ExecutorTaskDispatcher pooled =
      ExecutorTaskDispatcher.fixed(4, ProgressListener.NO_OP);

  @AfterEach
  void tearDown() {
    pooled.close();
  }

  @Test
  void should_gather_results_in_submission_order() {
    List<TaskHandle<Integer>> handles = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      int value = i;
      handles.add(
          pooled.submit(
              WorkUnit.of(
                  "unit-" + i,
                  () -> {
                    Thread.sleep((8 - value) * 5L);
                    return value * value;
                  })));
    }

    assertEquals(List.of(0, 1, 4, 9, 16, 25, 36, 49), pooled.gather("squares", handles));
  }

  @Test
  void should_report_progress_for_every_unit() {
    ExecutorTaskDispatcher dispatcher =
        new ExecutorTaskDispatcher(MoreExecutors.newDirectExecutorService(), progressListener);
    List<TaskHandle<String>> handles =
        List.of(
            dispatcher.submit(WorkUnit.of("a", () -> "a")),
            dispatcher.submit(WorkUnit.of("b", () -> "b")),
            dispatcher.submit(WorkUnit.of("c", () -> "c")));

    assertEquals(List.of("a", "b", "c"), dispatcher.gather("letters", handles));
    verify(progressListener).onStart("letters", 3);
    verify(progressListener, times(3)).onProgress(eq("letters"), anyInt(), eq(3));
    verify(progressListener).onFinish("letters", 3);
  }

  @Test
  void should_fail_with_unit_id_and_cause() {
    ExecutorTaskDispatcher dispatcher =
        new ExecutorTaskDispatcher(MoreExecutors.newDirectExecutorService(), progressListener);
    List<TaskHandle<Integer>> handles =
        List.of(
            dispatcher.submit(WorkUnit.of("ok", () -> 1)),
            dispatcher.submit(
                WorkUnit.<Integer>of(
                    "broken",
                    () -> {
                      throw new IllegalArgumentException("bad boundary");
                    })));

    TaskExecutionException e =
        assertThrows(TaskExecutionException.class, () -> dispatcher.gather("stage", handles));
    assertEquals("broken", e.getWorkUnitId());
    assertInstanceOf(IllegalArgumentException.class, e.getCause());
    verify(progressListener, never()).onFinish("stage", 2);
  }

  @Test
  void should_unwrap_checked_exception() {
    TaskHandle<Integer> handle =
        pooled.submit(
            WorkUnit.<Integer>of(
                "io",
                () -> {
                  throw new IOException("disk");
                }));

    TaskExecutionException e =
        assertThrows(TaskExecutionException.class, () -> pooled.gather("io", List.of(handle)));
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void should_cancel_pending_units_when_one_fails() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    TaskHandle<Integer> failing =
        pooled.submit(
            WorkUnit.<Integer>of(
                "failing",
                () -> {
                  throw new IllegalStateException("boom");
                }));
    TaskHandle<Integer> blocked =
        pooled.submit(
            WorkUnit.of(
                "blocked",
                () -> {
                  release.await(10, TimeUnit.SECONDS);
                  return 1;
                }));

    assertThrows(
        TaskExecutionException.class, () -> pooled.gather("stage", List.of(failing, blocked)));
    assertEquals(TaskHandle.State.FAILED, failing.getState());
    assertEquals(TaskHandle.State.CANCELLED, blocked.getState());
    release.countDown();
  }

  @Test
  void should_track_state_of_running_unit() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    TaskHandle<Integer> handle =
        pooled.submit(
            WorkUnit.of(
                "slow",
                () -> {
                  started.countDown();
                  release.await(10, TimeUnit.SECONDS);
                  return 42;
                }));

    started.await(10, TimeUnit.SECONDS);
    assertEquals(TaskHandle.State.RUNNING, handle.getState());
    release.countDown();
    assertEquals(List.of(42), pooled.gather("slow", List.of(handle)));
    assertEquals(TaskHandle.State.FINISHED, handle.getState());
  }
}
