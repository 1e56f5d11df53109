/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

import lombok.Getter;
import org.opensearch.blockagg.aggregation.AggregateFunction;
import org.opensearch.blockagg.aggregation.GroupKey;
import org.opensearch.blockagg.page.Block;
import org.opensearch.blockagg.page.Page;

/**
 * Base class of the built-in aggregations over one column. Handles "no value" and null
 * propagation so that subclasses only deal with non-null values.
 *
 * <p>With {@code ignoreNulls} set, nulls are skipped and a group without any non-null value
 * finalizes to null. Otherwise a single null anywhere in the group makes the result null.
 *
 * @param <T> partial result type
 * @param <R> result type
 */
public abstract class NullableAggregation<T, R>
    implements AggregateFunction<NullableAccumulator<T>, R> {

  @Getter private final String name;

  @Getter private final String on;

  @Getter private final boolean ignoreNulls;

  protected NullableAggregation(String name, String on, boolean ignoreNulls) {
    if (on == null || on.isBlank()) {
      throw new IllegalArgumentException(
          "Aggregation " + name + " requires a non-blank column name, got: " + on);
    }
    this.name = name;
    this.on = on;
    this.ignoreNulls = ignoreNulls;
  }

  /** Aggregates the values of a non-empty column. Returns null if there is nothing to report. */
  protected abstract T aggregateColumn(Block column);

  /** Combines two partial results. */
  protected abstract T mergeValues(T left, T right);

  /** Converts a partial result into the final value. */
  protected abstract R finalizeValue(T value);

  @Override
  public NullableAccumulator<T> init(GroupKey groupKey) {
    return NullableAccumulator.empty();
  }

  @Override
  public NullableAccumulator<T> accumulateBlock(NullableAccumulator<T> accumulator, Page block) {
    if (accumulator == null || block.isEmpty()) {
      return accumulator;
    }
    Block column = block.getBlock(on);
    if (!ignoreNulls && column.hasNull()) {
      return null;
    }
    T value = aggregateColumn(column);
    if (value == null) {
      return accumulator;
    }
    return merge(accumulator, NullableAccumulator.of(value));
  }

  @Override
  public NullableAccumulator<T> merge(NullableAccumulator<T> left, NullableAccumulator<T> right) {
    if (left == null || right == null) {
      return null;
    }
    if (!left.hasData()) {
      return right;
    }
    if (!right.hasData()) {
      return left;
    }
    return NullableAccumulator.of(mergeValues(left.value(), right.value()));
  }

  @Override
  public R finalizeResult(NullableAccumulator<T> accumulator) {
    if (accumulator == null || !accumulator.hasData()) {
      return null;
    }
    return finalizeValue(accumulator.value());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name=" + name + ", ignoreNulls=" + ignoreNulls + "}";
  }
}
