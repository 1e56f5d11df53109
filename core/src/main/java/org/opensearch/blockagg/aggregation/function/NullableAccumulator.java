/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

/**
 * Accumulator of the null-aware built-in aggregations. {@code hasData} is false until a non-null
 * value has been folded in. A null reference in place of the accumulator marks a group that saw a
 * null value while nulls are not ignored; such a group finalizes to null.
 *
 * @param <T> partial result type
 */
public record NullableAccumulator<T>(T value, boolean hasData) {

  public static <T> NullableAccumulator<T> empty() {
    return new NullableAccumulator<>(null, false);
  }

  public static <T> NullableAccumulator<T> of(T value) {
    return new NullableAccumulator<>(value, true);
  }
}
