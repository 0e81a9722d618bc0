package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record TreatmentSummary(
    OutlierMethod method,
    Double threshold,
    TreatmentStrategy strategy,
    @JsonProperty("strategy_value") String strategyValue,
    @JsonProperty("total_outliers") int totalOutliers,
    @JsonProperty("outliers_by_column") Map<String, Integer> outliersByColumn
) {}
