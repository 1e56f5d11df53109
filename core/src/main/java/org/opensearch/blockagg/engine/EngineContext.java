/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.engine;

import com.google.common.annotations.VisibleForTesting;
import java.util.ServiceLoader;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.blockagg.common.setting.Settings;
import org.opensearch.blockagg.dispatch.ExecutorTaskDispatcher;
import org.opensearch.blockagg.dispatch.LoggingProgressListener;
import org.opensearch.blockagg.dispatch.ProgressListener;
import org.opensearch.blockagg.dispatch.TaskDispatcher;
import org.opensearch.blockagg.sort.BackendNotAvailableException;
import org.opensearch.blockagg.sort.DefaultPageSorter;
import org.opensearch.blockagg.sort.PageSorter;
import org.opensearch.blockagg.sort.PageSorterProvider;

/**
 * Execution services shared by the partition and reduce operations: the configured sort backend
 * and the task dispatcher that runs boundary searches. Closing the context shuts the dispatcher
 * down.
 */
@Log4j2
@Getter
@RequiredArgsConstructor
public class EngineContext implements AutoCloseable {

  private final Settings settings;

  private final PageSorter pageSorter;

  private final TaskDispatcher taskDispatcher;

  /**
   * Creates a context from settings, looking the sort backend up among the {@link
   * PageSorterProvider}s registered with {@link ServiceLoader}.
   *
   * @throws BackendNotAvailableException if no provider has the configured backend name
   */
  public static EngineContext create(Settings settings) {
    return create(
        settings,
        ServiceLoader.load(PageSorterProvider.class, EngineContext.class.getClassLoader()));
  }

  @VisibleForTesting
  static EngineContext create(Settings settings, Iterable<PageSorterProvider> providers) {
    PageSorter pageSorter = resolvePageSorter(settings, providers);
    Integer parallelism = settings.getSettingValue(Settings.Key.DISPATCH_PARALLELISM);
    Boolean progressEnabled = settings.getSettingValue(Settings.Key.PROGRESS_ENABLED);
    ProgressListener listener =
        Boolean.TRUE.equals(progressEnabled)
            ? new LoggingProgressListener()
            : ProgressListener.NO_OP;
    log.info(
        "Creating engine context with sort backend {} and parallelism {}",
        pageSorter.getClass().getSimpleName(),
        parallelism);
    return new EngineContext(
        settings, pageSorter, ExecutorTaskDispatcher.fixed(parallelism, listener));
  }

  private static PageSorter resolvePageSorter(
      Settings settings, Iterable<PageSorterProvider> providers) {
    String backend = settings.getSettingValue(Settings.Key.SORT_BACKEND);
    for (PageSorterProvider provider : providers) {
      if (provider.getName().equals(backend)) {
        return provider.create(settings);
      }
    }
    throw new BackendNotAvailableException(
        String.format(
            "Sort backend [%s] is not available. Add it to the classpath or set [%s=%s]",
            backend,
            Settings.Key.SORT_BACKEND.getKeyValue(),
            DefaultPageSorter.NAME));
  }

  @Override
  public void close() {
    taskDispatcher.close();
  }
}
