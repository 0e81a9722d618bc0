package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record DetectionSummary(
    OutlierMethod method,
    Double threshold,
    @JsonProperty("total_outliers") int totalOutliers,
    @JsonProperty("outliers_by_column") Map<String, Integer> outliersByColumn,
    @JsonProperty("columns_analyzed") List<String> columnsAnalyzed
) {}
