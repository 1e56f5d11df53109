/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import lombok.experimental.UtilityClass;
import org.opensearch.blockagg.aggregation.function.Count;
import org.opensearch.blockagg.aggregation.function.Max;
import org.opensearch.blockagg.aggregation.function.Mean;
import org.opensearch.blockagg.aggregation.function.Min;
import org.opensearch.blockagg.aggregation.function.Std;
import org.opensearch.blockagg.aggregation.function.Sum;
import org.opensearch.blockagg.aggregation.function.SumOfSquaredDiffs;
import org.opensearch.blockagg.page.Page;

/** Factories of the built-in aggregations and of user-defined ones built from functions. */
@UtilityClass
public class AggregateFunctions {

  public static Count count() {
    return new Count();
  }

  public static Count count(String on) {
    return new Count(on);
  }

  public static Sum sum(String on) {
    return new Sum(on);
  }

  public static Min min(String on) {
    return new Min(on);
  }

  public static Max max(String on) {
    return new Max(on);
  }

  public static Mean mean(String on) {
    return new Mean(on);
  }

  public static Std std(String on) {
    return new Std(on);
  }

  public static SumOfSquaredDiffs sumOfSquaredDiffs(String on) {
    return new SumOfSquaredDiffs(on);
  }

  /**
   * Creates an aggregation from its four functions.
   *
   * @param name output column name
   * @param initFn creates the accumulator of a group
   * @param accumulateFn folds a block of rows into an accumulator
   * @param mergeFn combines two accumulators
   * @param finalizeFn converts an accumulator into the result
   */
  public static <A, R> AggregateFunction<A, R> of(
      String name,
      Function<GroupKey, A> initFn,
      BiFunction<A, Page, A> accumulateFn,
      BinaryOperator<A> mergeFn,
      Function<A, R> finalizeFn) {
    return new AggregateFunction<>() {
      @Override
      public A init(GroupKey groupKey) {
        return initFn.apply(groupKey);
      }

      @Override
      public A accumulateBlock(A accumulator, Page block) {
        return accumulateFn.apply(accumulator, block);
      }

      @Override
      public A merge(A left, A right) {
        return mergeFn.apply(left, right);
      }

      @Override
      public R finalizeResult(A accumulator) {
        return finalizeFn.apply(accumulator);
      }

      @Override
      public String getName() {
        return name;
      }

      @Override
      public String toString() {
        return "AggregateFunction{name=" + name + "}";
      }
    };
  }
}
