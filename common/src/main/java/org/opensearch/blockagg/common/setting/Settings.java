/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.common.setting;

import com.google.common.base.Strings;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Block aggregation settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Name of the {@code PageSorter} backend used for sorting and merge-sorting pages. */
    SORT_BACKEND("plugins.blockagg.sort.backend"),

    /** Number of worker threads used to run boundary searches. */
    DISPATCH_PARALLELISM("plugins.blockagg.dispatch.parallelism"),

    /** Whether dispatched work reports progress to the log. */
    PROGRESS_ENABLED("plugins.blockagg.progress.enabled");

    @Getter private final String keyValue;

    public static Optional<Key> of(String keyValue) {
      String key = Strings.nullToEmpty(keyValue);
      return Arrays.stream(Key.values()).filter(e -> e.keyValue.equals(key)).findFirst();
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);
}
