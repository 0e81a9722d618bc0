package com.ospicorp.dataops.summary;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.ops.Aggregations;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.semantic.ColumnRole;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class ColumnSummarizer {
  private static final Logger log = LoggerFactory.getLogger(ColumnSummarizer.class);

  private final ColumnClassifier classifier;

  public ColumnSummarizer(ColumnClassifier classifier) {
    this.classifier = classifier;
  }

  /** One summary per column, or just the named column when one is given. */
  public List<ColumnSummary> summarize(Table table, String column) {
    List<String> columns = table.columns();
    if (StringUtils.hasText(column)) {
      columns = List.of(resolveColumn(table, column));
    }
    List<ColumnSummary> out = new ArrayList<>(columns.size());
    for (String name : columns) {
      List<Object> cells = table.column(name);
      ColumnRole role = classifier.classify(name, cells, table.columns());
      out.add(summarizeColumn(name, role, cells));
    }
    log.debug("Summarized {} columns over {} rows", out.size(), table.rowCount());
    return out;
  }

  static ColumnSummary summarizeColumn(String name, ColumnRole role, List<Object> cells) {
    List<Object> present = new ArrayList<>(cells.size());
    for (Object cell : cells) {
      if (!Values.isMissing(cell)) present.add(cell);
    }

    Double mean = null;
    Double median = null;
    Double std = null;
    Double min = null;
    Double max = null;
    double[] numbers = numbers(present);
    if (numbers.length > 0) {
      mean = Values.round(StatUtils.mean(numbers));
      median = Values.round(Aggregations.quantile(numbers, 50d));
      std = numbers.length > 1 ? Values.round(Aggregations.sampleStd(numbers)) : null;
      min = Values.round(StatUtils.min(numbers));
      max = Values.round(StatUtils.max(numbers));
    }

    return new ColumnSummary(name, role, datatype(present), cells.size(),
        cells.size() - present.size(), present.size(), mean, median, std, min, max,
        Values.roundCell(mode(present)));
  }

  /** Numeric cells only; strings count when the whole column reads as numbers. */
  private static double[] numbers(List<Object> present) {
    boolean allConvert = !present.isEmpty();
    for (Object cell : present) {
      if (cell instanceof Boolean || cell instanceof LocalDate
          || Values.toDouble(cell) == null) {
        allConvert = false;
        break;
      }
    }
    if (!allConvert) return new double[0];
    double[] out = new double[present.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = Values.toDouble(present.get(i));
    }
    return out;
  }

  private static String datatype(List<Object> present) {
    if (present.isEmpty()) return "missing";
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Object cell : present) {
      counts.merge(Values.kind(cell), 1, Integer::sum);
    }
    if (counts.size() == 2 && counts.containsKey("integer") && counts.containsKey("float")) {
      return "float";
    }
    String best = null;
    int bestCount = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }

  private static Object mode(List<Object> present) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    Map<String, Object> firstSeen = new LinkedHashMap<>();
    for (Object cell : present) {
      String key = Values.key(cell);
      counts.merge(key, 1, Integer::sum);
      firstSeen.putIfAbsent(key, cell);
    }
    String best = null;
    int bestCount = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best == null ? null : firstSeen.get(best);
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
