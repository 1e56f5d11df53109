/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.page;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A page returned by a reduce step together with its metadata. */
@Getter
@RequiredArgsConstructor
public class ReducedPage {

  private final Page page;

  private final PageMetadata metadata;
}
