package com.ospicorp.dataops.semantic;

import com.ospicorp.dataops.error.OperationWarning;
import java.util.List;

/**
 * Resolved aggregation for one column: the role it was classified as, the function that will run
 * and the label the result column gets.
 */
public record AggregationSpec(
    String column,
    ColumnRole role,
    AggregationFunction function,
    String label,
    List<OperationWarning> warnings
) {
  public AggregationSpec {
    warnings = List.copyOf(warnings);
  }
}
