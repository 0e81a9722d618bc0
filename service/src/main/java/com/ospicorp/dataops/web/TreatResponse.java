package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.outliers.TreatResult;
import com.ospicorp.dataops.outliers.TreatmentSummary;
import com.ospicorp.dataops.table.Table;

public record TreatResponse(
    Table data,
    @JsonProperty("rows_before") int rowsBefore,
    @JsonProperty("rows_after") int rowsAfter,
    @JsonProperty("treated_count") int treatedCount,
    TreatmentSummary summary
) {
  static TreatResponse of(TreatResult result) {
    return new TreatResponse(result.data(), result.rowsBefore(), result.rowsAfter(),
        result.treatedCount(), result.summary());
  }
}
