package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.table.Values;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

final class Rows {
  private Rows() {
  }

  /** Stable in-place sort on one column; missing values stay last in either direction. */
  static void sort(List<Map<String, Object>> rows, String column, boolean descending) {
    Comparator<Map<String, Object>> comparator = (a, b) -> {
      Object left = a.get(column);
      Object right = b.get(column);
      if (left == null || right == null) {
        return Values.compare(left, right);
      }
      int cmp = Values.compare(left, right);
      return descending ? -cmp : cmp;
    };
    rows.sort(comparator);
  }
}
