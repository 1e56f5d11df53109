/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.opensearch.blockagg.page.Page;
import org.opensearch.blockagg.sort.ValueComparator;

/**
 * Values of the grouping columns of one row. Two keys are equal when their values are pairwise
 * equal under {@link ValueComparator#valuesEqual(Object, Object)}, so numerically equal numbers of
 * different boxed types belong to the same group and nulls form a group of their own.
 */
public final class GroupKey {

  private static final GroupKey GLOBAL = new GroupKey(Collections.emptyList(), true);

  private final List<Object> values;
  private final boolean global;

  private GroupKey(List<Object> values, boolean global) {
    this.values = values;
    this.global = global;
  }

  /** The key of the single group of a global aggregation. */
  public static GroupKey global() {
    return GLOBAL;
  }

  public static GroupKey of(Object... values) {
    return new GroupKey(Collections.unmodifiableList(Arrays.asList(values.clone())), false);
  }

  public static GroupKey of(List<?> values) {
    return new GroupKey(Collections.unmodifiableList(new ArrayList<>(values)), false);
  }

  /** Reads the key of the row at {@code position} from the given channels. */
  public static GroupKey fromRow(Page page, int position, int[] channels) {
    Object[] values = new Object[channels.length];
    for (int i = 0; i < channels.length; i++) {
      values[i] = page.getValue(position, channels[i]);
    }
    return new GroupKey(Collections.unmodifiableList(Arrays.asList(values)), false);
  }

  public boolean isGlobal() {
    return global;
  }

  public List<Object> getValues() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public Object get(int index) {
    return values.get(index);
  }

  /** Returns true if the row at {@code position} has this key in the given channels. */
  public boolean matches(Page page, int position, int[] channels) {
    if (global) {
      return true;
    }
    for (int i = 0; i < channels.length; i++) {
      if (!ValueComparator.valuesEqual(values.get(i), page.getValue(position, channels[i]))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey other = (GroupKey) o;
    if (global != other.global || values.size() != other.values.size()) {
      return false;
    }
    for (int i = 0; i < values.size(); i++) {
      if (!ValueComparator.valuesEqual(values.get(i), other.values.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int hash = Boolean.hashCode(global);
    for (Object value : values) {
      // numerically equal numbers have equal double values
      int valueHash =
          value instanceof Number
              ? Double.hashCode(((Number) value).doubleValue())
              : Objects.hashCode(value);
      hash = 31 * hash + valueHash;
    }
    return hash;
  }

  @Override
  public String toString() {
    return global ? "GroupKey{global}" : "GroupKey" + values;
  }
}
