/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.combine;

import org.opensearch.blockagg.aggregation.GroupKey;

/** A maximal range {@code [start, end)} of consecutive rows sharing one group key. */
public record GroupRun(GroupKey key, int start, int end) {

  public int length() {
    return end - start;
  }
}
