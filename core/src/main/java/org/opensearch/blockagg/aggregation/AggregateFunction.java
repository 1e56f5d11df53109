/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import org.opensearch.blockagg.page.Page;

/**
 * A pluggable aggregation. The engine never inspects accumulators: it creates them with {@link
 * #init(GroupKey)}, feeds them contiguous row ranges of one group with {@link
 * #accumulateBlock(Object, Page)}, combines partial results of the same group with {@link
 * #merge(Object, Object)} and turns the final accumulator into the user visible value with {@link
 * #finalizeResult(Object)}.
 *
 * <p>Groups are split across pages in ways the caller does not control, so {@code merge} must be
 * associative and commutative, and merging partial accumulators must give the same result as
 * accumulating all rows at once.
 *
 * @param <A> accumulator type
 * @param <R> result type
 */
public interface AggregateFunction<A, R> {

  /**
   * Creates a fresh accumulator for one group.
   *
   * @param groupKey key of the group, {@link GroupKey#global()} for a global aggregation
   * @return accumulator representing zero rows
   */
  A init(GroupKey groupKey);

  /**
   * Folds every row of the block into the accumulator. The block holds rows of a single group. A
   * column without any non-null value must not fail; it contributes "no value".
   *
   * @param accumulator current accumulator
   * @param block contiguous rows of the group
   * @return the updated accumulator
   */
  A accumulateBlock(A accumulator, Page block);

  /**
   * Combines two accumulators built from disjoint rows of the same group.
   *
   * @return the merged accumulator
   */
  A merge(A left, A right);

  /**
   * Converts the accumulator into the aggregation result.
   *
   * @return the result, or null for "no value"
   */
  R finalizeResult(A accumulator);

  /** Output column name, before collision resolution. */
  String getName();
}
