package com.ospicorp.dataops.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import java.util.Map;

/** Shared by detection and treatment; detection ignores the strategy fields. */
public record OutlierRequestBody(
    List<Map<String, Object>> data,
    @Schema(description = "Column to analyze; omit to scan every measure column") String column,
    @Schema(allowableValues = {"iqr", "zscore", "isolation_forest", "local_outlier_factor"})
    String method,
    Double threshold,
    @Schema(allowableValues = {"remove", "cap", "winsorize", "transform", "impute"})
    String strategy,
    @JsonProperty("strategy_value")
    @Schema(description = "Winsorize percentile, or imputation statistic / constant")
    String strategyValue
) {}
