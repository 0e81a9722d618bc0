package com.ospicorp.dataops.outliers;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Descriptive statistics of a column's non-missing values, rounded to two decimals. */
public record ColumnStatistics(
    long count,
    Double mean,
    Double median,
    Double std,
    Double min,
    Double max,
    Double q1,
    Double q3,
    Double iqr,
    @JsonProperty("lower_bound") Double lowerBound,
    @JsonProperty("upper_bound") Double upperBound,
    @JsonProperty("outlier_count") long outlierCount
) {}
