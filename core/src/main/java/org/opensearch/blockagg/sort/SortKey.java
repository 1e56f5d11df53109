/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.sort;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Compound sort order: an ordered, non-empty list of {@link SortField}s. The first field is the
 * primary sort column, later fields break ties. Nulls sort after every non-null value regardless
 * of direction.
 */
@EqualsAndHashCode
public final class SortKey {

  @Getter private final List<SortField> fields;

  private SortKey(List<SortField> fields) {
    Preconditions.checkArgument(!fields.isEmpty(), "Sort key must have at least one column");
    this.fields = ImmutableList.copyOf(fields);
  }

  public static SortKey of(List<SortField> fields) {
    return new SortKey(fields);
  }

  /** Ascending sort key over the given columns. */
  public static SortKey ascending(String... columnNames) {
    return ascending(List.of(columnNames));
  }

  /** Ascending sort key over the given columns. */
  public static SortKey ascending(List<String> columnNames) {
    return new SortKey(
        columnNames.stream()
            .map(name -> new SortField(name, SortOrder.ASCENDING))
            .collect(Collectors.toList()));
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return fields.size();
  }

  public SortField get(int index) {
    return fields.get(index);
  }

  public List<String> getColumnNames() {
    return fields.stream().map(SortField::columnName).collect(Collectors.toList());
  }

  /** Returns the key made of the first {@code length} fields. */
  public SortKey prefix(int length) {
    Preconditions.checkArgument(
        length > 0 && length <= fields.size(),
        "Prefix length %s out of range [1, %s]",
        length,
        fields.size());
    return new SortKey(fields.subList(0, length));
  }

  @Override
  public String toString() {
    return fields.stream()
        .map(f -> f.columnName() + " " + f.order().name().toLowerCase(Locale.ROOT))
        .collect(Collectors.joining(", ", "[", "]"));
  }

  /** Fluent builder of a compound sort key. */
  public static class Builder {
    private final List<SortField> fields = new ArrayList<>();

    public Builder ascending(String columnName) {
      fields.add(new SortField(columnName, SortOrder.ASCENDING));
      return this;
    }

    public Builder descending(String columnName) {
      fields.add(new SortField(columnName, SortOrder.DESCENDING));
      return this;
    }

    public Builder add(String columnName, SortOrder order) {
      fields.add(new SortField(columnName, order));
      return this;
    }

    public SortKey build() {
      return new SortKey(fields);
    }
  }
}
