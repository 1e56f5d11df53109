/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation.function;

/**
 * Standard deviation of a numeric column, {@code sqrt(M2 / (count - ddof))}. A group with a single
 * value has a standard deviation of 0.
 */
public class Std extends MomentAggregation<Double> {

  private final int ddof;

  public Std(String on) {
    this(on, 1, true);
  }

  public Std(String on, int ddof, boolean ignoreNulls) {
    this("std(" + on + ")", on, ddof, ignoreNulls);
  }

  public Std(String name, String on, int ddof, boolean ignoreNulls) {
    super(name, on, ignoreNulls);
    if (ddof < 0) {
      throw new IllegalArgumentException("ddof must be non-negative, got: " + ddof);
    }
    this.ddof = ddof;
  }

  @Override
  protected Double finalizeValue(State value) {
    if (value.count() == 1) {
      return 0.0;
    }
    if (value.count() <= ddof) {
      return null;
    }
    return Math.sqrt(value.m2() / (value.count() - ddof));
  }
}
