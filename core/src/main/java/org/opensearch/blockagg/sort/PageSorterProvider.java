/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import org.opensearch.blockagg.common.setting.Settings;

/**
 * Service provider of a {@link PageSorter} backend, discovered through {@link
 * java.util.ServiceLoader} and selected by the {@code plugins.blockagg.sort.backend} setting.
 */
public interface PageSorterProvider {

  /** Backend name matched against the setting value. */
  String getName();

  PageSorter create(Settings settings);
}
