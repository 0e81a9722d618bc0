package com.ospicorp.dataops.outliers;

import java.util.List;
import java.util.Map;

public record DetectResult(
    List<OutlierRecord> outliers,
    DetectionSummary summary,
    Map<String, ColumnStatistics> statistics
) {}
