package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.ops.PivotResult;
import com.ospicorp.dataops.table.Table;
import java.util.List;

public record PivotResponse(
    Table data,
    @JsonProperty("rows_before") int rowsBefore,
    @JsonProperty("rows_after") int rowsAfter,
    @JsonProperty("preserved_columns") List<String> preservedColumns,
    List<AppliedAggregation> aggregations,
    List<OperationWarning> warnings
) {
  static PivotResponse of(PivotResult result) {
    return new PivotResponse(result.data(), result.rowsBefore(), result.rowsAfter(),
        result.preservedColumns(), result.specs().stream().map(AppliedAggregation::of).toList(),
        result.warnings());
  }
}
