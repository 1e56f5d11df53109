/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.aggregation;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Output column names of a list of aggregations. The first aggregation with a given name keeps it;
 * the n-th repeat is named {@code name_n}. The result depends only on the order of the names, so
 * the combine and merge phases derive the same columns from the same aggregation list.
 */
@UtilityClass
public class AggregateColumnNames {

  public static List<String> resolve(List<? extends AggregateFunction<?, ?>> aggregations) {
    Map<String, Integer> occurrences = new HashMap<>();
    Set<String> used = new HashSet<>();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (AggregateFunction<?, ?> aggregation : aggregations) {
      String name = aggregation.getName();
      int occurrence = occurrences.getOrDefault(name, 0);
      String candidate = occurrence == 0 ? name : name + "_" + occurrence;
      // skip suffixes already taken by a literal name such as "count_1"
      while (used.contains(candidate)) {
        occurrence++;
        candidate = name + "_" + occurrence;
      }
      occurrences.put(name, occurrence + 1);
      used.add(candidate);
      names.add(candidate);
    }
    return names.build();
  }
}
