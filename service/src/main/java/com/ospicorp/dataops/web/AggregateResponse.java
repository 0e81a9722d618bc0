package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.ops.AggregateResult;
import com.ospicorp.dataops.table.Table;
import java.util.List;

public record AggregateResponse(
    Table data,
    @JsonProperty("rows_before") int rowsBefore,
    @JsonProperty("rows_after") int rowsAfter,
    List<AppliedAggregation> aggregations,
    List<OperationWarning> warnings
) {
  static AggregateResponse of(AggregateResult result) {
    return new AggregateResponse(result.data(), result.rowsBefore(), result.rowsAfter(),
        result.specs().stream().map(AppliedAggregation::of).toList(), result.warnings());
  }
}
