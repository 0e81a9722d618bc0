package com.ospicorp.dataops.summary;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.dataops.semantic.ColumnRole;

/**
 * Descriptive statistics of one column. The numeric fields stay {@code null} for columns
 * without numeric values.
 *
 * @param datatype the most common value kind among non-missing cells
 */
public record ColumnSummary(
    String variable,
    ColumnRole role,
    String datatype,
    @JsonProperty("total_values") int totalValues,
    @JsonProperty("null_values") int nullValues,
    @JsonProperty("non_null_values") int nonNullValues,
    Double mean,
    Double median,
    @JsonProperty("std_dev") Double stdDev,
    Double min,
    Double max,
    Object mode
) {}
