package com.ospicorp.dataops.outliers;

import com.ospicorp.dataops.error.ComputationException;
import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.ops.Aggregations;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.semantic.ColumnRole;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class OutlierDetector {
  private static final Logger log = LoggerFactory.getLogger(OutlierDetector.class);

  private final ColumnClassifier classifier;
  private final List<OutlierScoringBackend> backends;
  private final double iqrThreshold;
  private final double zscoreThreshold;

  @Autowired
  public OutlierDetector(ColumnClassifier classifier,
      ObjectProvider<OutlierScoringBackend> backends,
      @Value("${dataops.outliers.iqr-threshold:1.5}") double iqrThreshold,
      @Value("${dataops.outliers.zscore-threshold:3.0}") double zscoreThreshold) {
    this(classifier, backends.orderedStream().toList(), iqrThreshold, zscoreThreshold);
  }

  public OutlierDetector(ColumnClassifier classifier, List<OutlierScoringBackend> backends,
      double iqrThreshold, double zscoreThreshold) {
    this.classifier = classifier;
    this.backends = List.copyOf(backends);
    this.iqrThreshold = iqrThreshold;
    this.zscoreThreshold = zscoreThreshold;
  }

  /** Flagged cells of one column together with the bounds that flagged them. */
  record ColumnDetection(
      String column,
      int[] rows,
      double[] values,
      boolean[] flags,
      double mean,
      Double std,
      Double lowerBound,
      Double upperBound,
      ColumnStatistics statistics
  ) {
    int flaggedCount() {
      int count = 0;
      for (boolean flag : flags) {
        if (flag) count++;
      }
      return count;
    }

    double[] unflaggedValues() {
      double[] kept = new double[values.length - flaggedCount()];
      int j = 0;
      for (int i = 0; i < values.length; i++) {
        if (!flags[i]) kept[j++] = values[i];
      }
      return kept;
    }
  }

  public DetectResult detect(Table table, String column, OutlierMethod method, Double threshold) {
    Double effectiveThreshold = effectiveThreshold(method, threshold);
    List<ColumnDetection> detections = detectColumns(table, column, method, effectiveThreshold);

    List<OutlierRecord> outliers = new ArrayList<>();
    Map<String, ColumnStatistics> statistics = new LinkedHashMap<>();
    Map<String, Integer> byColumn = new LinkedHashMap<>();
    List<String> analyzed = new ArrayList<>();
    for (ColumnDetection detection : detections) {
      analyzed.add(detection.column());
      statistics.put(detection.column(), detection.statistics());
      int flagged = 0;
      for (int i = 0; i < detection.values().length; i++) {
        if (!detection.flags()[i]) continue;
        flagged++;
        int row = detection.rows()[i];
        double value = detection.values()[i];
        Object cell = table.get(row, detection.column());
        outliers.add(new OutlierRecord(row, detection.column(),
            cell instanceof Long ? cell : Values.round(value),
            method,
            Values.round(detection.lowerBound()),
            Values.round(detection.upperBound()),
            Values.round(score(method, detection, value))));
      }
      if (flagged > 0) {
        byColumn.put(detection.column(), flagged);
      }
    }

    log.debug("Detected {} outliers with {} (threshold {}) across {}", outliers.size(),
        method.methodName(), effectiveThreshold, analyzed);
    DetectionSummary summary = new DetectionSummary(method, effectiveThreshold, outliers.size(),
        byColumn, analyzed);
    return new DetectResult(outliers, summary, statistics);
  }

  Double effectiveThreshold(OutlierMethod method, Double threshold) {
    if (threshold != null && !(threshold > 0d)) {
      throw new InvalidInputException("Threshold must be positive", "invalid-threshold",
          "Got " + threshold + "; defaults are " + iqrThreshold + " for iqr and "
              + zscoreThreshold + " for zscore");
    }
    return switch (method) {
      case IQR -> threshold != null ? threshold : iqrThreshold;
      case ZSCORE -> threshold != null ? threshold : zscoreThreshold;
      default -> threshold;
    };
  }

  List<ColumnDetection> detectColumns(Table table, String column, OutlierMethod method,
      Double threshold) {
    OutlierScoringBackend backend = method.needsBackend() ? backendFor(method) : null;
    List<ColumnDetection> detections = new ArrayList<>();
    if (StringUtils.hasText(column)) {
      String name = resolveColumn(table, column);
      ColumnDetection detection = detectColumn(table, name, method, threshold, backend);
      if (detection == null) {
        throw new ComputationException("Column \"" + name + "\" has no numeric values",
            "statistic-undefined",
            "Outlier statistics need at least one numeric value in \"" + name + "\"");
      }
      detections.add(detection);
      return detections;
    }
    Map<String, ColumnRole> roles = classifier.classifyAll(table);
    for (Map.Entry<String, ColumnRole> entry : roles.entrySet()) {
      if (!entry.getValue().isMeasure()) continue;
      ColumnDetection detection = detectColumn(table, entry.getKey(), method, threshold, backend);
      if (detection == null) {
        log.debug("Skipping column {}: no numeric values", entry.getKey());
        continue;
      }
      detections.add(detection);
    }
    return detections;
  }

  private ColumnDetection detectColumn(Table table, String column, OutlierMethod method,
      Double threshold, OutlierScoringBackend backend) {
    List<Object> cells = table.column(column);
    int[] rows = new int[cells.size()];
    double[] values = new double[cells.size()];
    int n = 0;
    for (int i = 0; i < cells.size(); i++) {
      Double d = Values.toDouble(cells.get(i));
      if (d != null) {
        rows[n] = i;
        values[n] = d;
        n++;
      }
    }
    if (n == 0) return null;
    rows = Arrays.copyOf(rows, n);
    values = Arrays.copyOf(values, n);

    double mean = StatUtils.mean(values);
    Double std = n > 1 ? Aggregations.sampleStd(values) : null;
    double q1 = Aggregations.quantile(values, 25d);
    double median = Aggregations.quantile(values, 50d);
    double q3 = Aggregations.quantile(values, 75d);
    double iqr = q3 - q1;

    boolean[] flags = new boolean[n];
    Double lower = null;
    Double upper = null;
    switch (method) {
      case IQR -> {
        lower = q1 - threshold * iqr;
        upper = q3 + threshold * iqr;
        for (int i = 0; i < n; i++) {
          flags[i] = values[i] < lower || values[i] > upper;
        }
      }
      case ZSCORE -> {
        if (std != null && std > 0d) {
          lower = mean - threshold * std;
          upper = mean + threshold * std;
          for (int i = 0; i < n; i++) {
            flags[i] = Math.abs((values[i] - mean) / std) > threshold;
          }
        } else {
          lower = mean;
          upper = mean;
        }
      }
      default -> {
        boolean[] scored = backend.flag(method, values.clone(), threshold);
        if (scored == null || scored.length != n) {
          throw new ComputationException("Backend returned " + (scored == null ? 0 : scored.length)
              + " flags for " + n + " values of \"" + column + "\"", "backend-failure",
              backend.getClass().getName());
        }
        flags = scored;
      }
    }

    int flagged = 0;
    for (boolean flag : flags) {
      if (flag) flagged++;
    }
    ColumnStatistics statistics = new ColumnStatistics(n, Values.round(mean),
        Values.round(median), Values.round(std), Values.round(StatUtils.min(values)),
        Values.round(StatUtils.max(values)), Values.round(q1), Values.round(q3),
        Values.round(iqr), Values.round(lower), Values.round(upper), flagged);
    return new ColumnDetection(column, rows, values, flags, mean, std, lower, upper, statistics);
  }

  private static Double score(OutlierMethod method, ColumnDetection detection, double value) {
    Double std = detection.std();
    if (method != OutlierMethod.ZSCORE || std == null || std == 0d) return null;
    return (value - detection.mean()) / std;
  }

  private OutlierScoringBackend backendFor(OutlierMethod method) {
    for (OutlierScoringBackend backend : backends) {
      if (backend.supports(method)) {
        return backend;
      }
    }
    throw new ComputationException(
        "Outlier method " + method.methodName() + " needs a statistical backend that is not available",
        "backend-unavailable",
        "Register an OutlierScoringBackend supporting " + method.methodName()
            + ", or use iqr or zscore");
  }

  private static String resolveColumn(Table table, String column) {
    if (table.hasColumn(column)) return column;
    String lower = column.trim().toLowerCase(Locale.ROOT);
    for (String candidate : table.columns()) {
      if (candidate.toLowerCase(Locale.ROOT).equals(lower)) return candidate;
    }
    throw InvalidInputException.unknownColumn(column, table.columns());
  }
}
