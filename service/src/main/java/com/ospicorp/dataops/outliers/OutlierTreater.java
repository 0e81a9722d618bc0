package com.ospicorp.dataops.outliers;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.ops.Aggregations;
import com.ospicorp.dataops.outliers.OutlierDetector.ColumnDetection;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Applies a remediation strategy to the cells {@link OutlierDetector} flags. Detection always
 * runs afresh on the given table, so treating never depends on an earlier detect call.
 */
@Service
public class OutlierTreater {
  private static final Logger log = LoggerFactory.getLogger(OutlierTreater.class);

  private final OutlierDetector detector;
  private final double winsorizePercentile;

  public OutlierTreater(OutlierDetector detector,
      @Value("${dataops.outliers.winsorize-percentile:5}") double winsorizePercentile) {
    this.detector = detector;
    this.winsorizePercentile = winsorizePercentile;
  }

  public TreatResult treat(Table table, String column, OutlierMethod method, Double threshold,
      TreatmentStrategy strategy, String strategyValue) {
    Double effectiveThreshold = detector.effectiveThreshold(method, threshold);
    List<ColumnDetection> detections =
        detector.detectColumns(table, column, method, effectiveThreshold);

    Map<String, Integer> byColumn = new LinkedHashMap<>();
    int flaggedCells = 0;
    for (ColumnDetection detection : detections) {
      int flagged = detection.flaggedCount();
      if (flagged > 0) {
        byColumn.put(detection.column(), flagged);
        flaggedCells += flagged;
      }
    }

    Table treated;
    int treatedCount;
    if (strategy == TreatmentStrategy.REMOVE) {
      Set<Integer> doomed = new TreeSet<>();
      for (ColumnDetection detection : detections) {
        for (int i = 0; i < detection.flags().length; i++) {
          if (detection.flags()[i]) doomed.add(detection.rows()[i]);
        }
      }
      treated = table.withoutRows(doomed);
      treatedCount = doomed.size();
    } else {
      List<Map<String, Object>> records = table.toRecords();
      for (ColumnDetection detection : detections) {
        if (detection.flaggedCount() == 0) continue;
        switch (strategy) {
          case CAP -> clamp(records, detection, capBounds(detection));
          case WINSORIZE -> clamp(records, detection, percentileBounds(detection, strategyValue));
          case TRANSFORM -> transform(records, detection);
          case IMPUTE -> impute(records, detection, strategyValue);
          default -> throw new IllegalStateException("Unhandled strategy " + strategy);
        }
      }
      treated = Table.of(table.columns(), records);
      treatedCount = flaggedCells;
    }

    treated = treated.rounded();
    log.debug("Treated {} outliers with {} / {}: {} rows -> {} rows", treatedCount,
        method.methodName(), strategy.strategyName(), table.rowCount(), treated.rowCount());
    TreatmentSummary summary = new TreatmentSummary(method, effectiveThreshold, strategy,
        strategyValue, flaggedCells, byColumn);
    return new TreatResult(treated, table.rowCount(), treated.rowCount(), treatedCount, summary);
  }

  private static double[] capBounds(ColumnDetection detection) {
    if (detection.lowerBound() != null && detection.upperBound() != null) {
      return new double[] {detection.lowerBound(), detection.upperBound()};
    }
    double[] kept = detection.unflaggedValues();
    double[] source = kept.length > 0 ? kept : detection.values();
    return new double[] {StatUtils.min(source), StatUtils.max(source)};
  }

  private double[] percentileBounds(ColumnDetection detection, String strategyValue) {
    double p = winsorizePercentile;
    if (StringUtils.hasText(strategyValue)) {
      Double parsed = Values.parseNumber(strategyValue);
      if (parsed == null) {
        throw new InvalidInputException("Winsorize percentile must be a number",
            "invalid-strategy-value", "Got \"" + strategyValue + "\"; use e.g. 5 for the 5th/95th percentiles");
      }
      p = parsed;
    }
    if (!(p > 0d && p < 50d)) {
      throw new InvalidInputException("Winsorize percentile must be between 0 and 50",
          "invalid-strategy-value", "Got " + p);
    }
    return new double[] {
        Aggregations.quantile(detection.values(), p),
        Aggregations.quantile(detection.values(), 100d - p)};
  }

  private static void clamp(List<Map<String, Object>> records, ColumnDetection detection,
      double[] bounds) {
    for (int i = 0; i < detection.flags().length; i++) {
      if (!detection.flags()[i]) continue;
      double value = Math.max(bounds[0], Math.min(bounds[1], detection.values()[i]));
      records.get(detection.rows()[i]).put(detection.column(), value);
    }
  }

  /** log1p when every value is positive, signed square root otherwise; applied to the whole column. */
  private static void transform(List<Map<String, Object>> records, ColumnDetection detection) {
    boolean allPositive = StatUtils.min(detection.values()) > 0d;
    for (int i = 0; i < detection.values().length; i++) {
      double v = detection.values()[i];
      double out = allPositive ? Math.log1p(v) : Math.signum(v) * Math.sqrt(Math.abs(v));
      records.get(detection.rows()[i]).put(detection.column(), out);
    }
  }

  private static void impute(List<Map<String, Object>> records, ColumnDetection detection,
      String strategyValue) {
    double replacement = replacement(detection.unflaggedValues(), strategyValue);
    for (int i = 0; i < detection.flags().length; i++) {
      if (detection.flags()[i]) {
        records.get(detection.rows()[i]).put(detection.column(), replacement);
      }
    }
  }

  static double replacement(double[] remaining, String strategyValue) {
    String statistic = StringUtils.hasText(strategyValue)
        ? strategyValue.trim().toLowerCase(Locale.ROOT) : "median";
    Double value = switch (statistic) {
      case "mean", "average", "avg" -> remaining.length == 0 ? null : StatUtils.mean(remaining);
      case "median" -> median(remaining);
      case "mode" -> mode(remaining);
      case "min" -> remaining.length == 0 ? null : StatUtils.min(remaining);
      case "max" -> remaining.length == 0 ? null : StatUtils.max(remaining);
      default -> {
        Double constant = Values.parseNumber(statistic);
        if (constant == null) {
          throw new InvalidInputException("Unknown imputation value \"" + strategyValue + "\"",
              "invalid-strategy-value", "Use mean, median, mode, min, max or a number");
        }
        yield constant;
      }
    };
    if (value == null) {
      value = median(remaining);
    }
    return value != null ? value : 0d;
  }

  private static Double median(double[] values) {
    return values.length == 0 ? null : Aggregations.quantile(values, 50d);
  }

  /** Most frequent value, the earliest one on ties. */
  private static Double mode(double[] values) {
    Map<Double, Integer> counts = new LinkedHashMap<>();
    for (double v : values) {
      counts.merge(v, 1, Integer::sum);
    }
    Double best = null;
    int bestCount = 0;
    for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }
}
