package com.ospicorp.dataops.table;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builders for small literal tables in tests; unlike {@code Map.of} they keep order and nulls. */
public final class TestTables {
  private TestTables() {
  }

  public static Map<String, Object> row(Object... keyValues) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      row.put((String) keyValues[i], keyValues[i + 1]);
    }
    return row;
  }

  @SafeVarargs
  public static Table table(Map<String, Object>... rows) {
    return Table.of(Arrays.asList(rows));
  }

  /** One-column table holding the given values in order. */
  public static Table column(String name, Object... values) {
    return Table.of(List.of(name), Arrays.stream(values).map(v -> row(name, v)).toList());
  }
}
