package com.ospicorp.dataops.web;

import com.ospicorp.dataops.semantic.AggregationFunction;
import com.ospicorp.dataops.semantic.AggregationSpec;
import com.ospicorp.dataops.semantic.ColumnRole;

public record AppliedAggregation(
    String column,
    ColumnRole role,
    AggregationFunction function,
    String label
) {
  static AppliedAggregation of(AggregationSpec spec) {
    return new AppliedAggregation(spec.column(), spec.role(), spec.function(), spec.label());
  }
}
