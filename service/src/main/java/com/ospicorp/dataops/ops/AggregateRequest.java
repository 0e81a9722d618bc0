package com.ospicorp.dataops.ops;

import java.util.List;
import java.util.Map;

/**
 * @param valueColumns columns to aggregate; {@code null} or empty selects every aggregatable
 *     column
 * @param functions per-column function overrides by name ({@code sum}, {@code avg}, ...)
 * @param orderDirection {@code asc} (default) or {@code desc}
 * @param intent free-text hint such as "average order value"
 */
public record AggregateRequest(
    String groupBy,
    List<String> valueColumns,
    Map<String, String> functions,
    String orderBy,
    String orderDirection,
    String intent
) {
  public static AggregateRequest groupBy(String groupBy, List<String> valueColumns) {
    return new AggregateRequest(groupBy, valueColumns, null, null, null, null);
  }
}
