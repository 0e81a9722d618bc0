package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OutlierRecord(
    @JsonProperty("row_index") int rowIndex,
    String column,
    Object value,
    OutlierMethod method,
    @JsonProperty("lower_bound") Double lowerBound,
    @JsonProperty("upper_bound") Double upperBound,
    Double score
) {}
