package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.outliers.DetectResult;
import com.ospicorp.dataops.outliers.OutlierDetector;
import com.ospicorp.dataops.outliers.OutlierMethod;
import com.ospicorp.dataops.outliers.OutlierTreater;
import com.ospicorp.dataops.outliers.TreatResult;
import com.ospicorp.dataops.outliers.TreatmentStrategy;
import com.ospicorp.dataops.summary.ColumnSummarizer;
import com.ospicorp.dataops.summary.ColumnSummary;
import com.ospicorp.dataops.table.Table;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers holding rows as plain maps. Each call builds its own {@link Table}
 * copy, so the caller's rows are never modified.
 */
@Service
public class DataOpsService {
  private final GroupAggregator aggregator;
  private final PivotReshaper reshaper;
  private final OutlierDetector detector;
  private final OutlierTreater treater;
  private final ColumnSummarizer summarizer;

  public DataOpsService(GroupAggregator aggregator, PivotReshaper reshaper,
      OutlierDetector detector, OutlierTreater treater, ColumnSummarizer summarizer) {
    this.aggregator = aggregator;
    this.reshaper = reshaper;
    this.detector = detector;
    this.treater = treater;
    this.summarizer = summarizer;
  }

  public AggregateResult aggregate(List<? extends Map<String, ?>> rows, AggregateRequest request) {
    return aggregator.aggregate(Table.of(rows), request);
  }

  public PivotResult pivot(List<? extends Map<String, ?>> rows, PivotRequest request) {
    return reshaper.pivot(Table.of(rows), request);
  }

  /**
   * @param method method name such as {@code iqr} or {@code zscore}; {@code null} means iqr
   * @param threshold {@code null} uses the configured default for the method
   */
  public DetectResult detectOutliers(List<? extends Map<String, ?>> rows, String column,
      String method, Double threshold) {
    return detector.detect(Table.of(rows), column, OutlierMethod.fromName(method), threshold);
  }

  public TreatResult treatOutliers(List<? extends Map<String, ?>> rows, String column,
      String method, Double threshold, String strategy, String strategyValue) {
    return treater.treat(Table.of(rows), column, OutlierMethod.fromName(method), threshold,
        TreatmentStrategy.fromName(strategy), strategyValue);
  }

  public List<ColumnSummary> summarize(List<? extends Map<String, ?>> rows, String column) {
    return summarizer.summarize(Table.of(rows), column);
  }
}
