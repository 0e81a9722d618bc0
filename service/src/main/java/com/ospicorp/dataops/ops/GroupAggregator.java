package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.error.WarningCode;
import com.ospicorp.dataops.semantic.AggregationSpec;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.semantic.ColumnRole;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Groups rows by one key column and aggregates every value column with the function its role
 * calls for. Groups come out in order of first appearance unless a sort column is given.
 */
@Service
public class GroupAggregator {
  private static final Logger log = LoggerFactory.getLogger(GroupAggregator.class);

  private final ColumnClassifier classifier;

  public GroupAggregator(ColumnClassifier classifier) {
    this.classifier = classifier;
  }

  public AggregateResult aggregate(Table table, AggregateRequest request) {
    String groupBy = request.groupBy();
    if (!StringUtils.hasText(groupBy)) {
      throw new InvalidInputException("Group column must be provided", "missing-group-column",
          "Available columns: " + String.join(", ", table.columns()));
    }
    if (!table.hasColumn(groupBy)) {
      throw InvalidInputException.unknownColumn(groupBy, table.columns());
    }

    Map<String, ColumnRole> roles = classifier.classifyAll(table);
    List<OperationWarning> warnings = new ArrayList<>();
    List<AggregationSpec> specs = ValueColumns.resolve(classifier, table, roles,
        request.valueColumns(), groupBy, request.functions(), request.intent(), warnings);

    Map<String, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    Map<String, Object> keyValues = new LinkedHashMap<>();
    for (Map<String, Object> row : table.rows()) {
      Object value = row.get(groupBy);
      if (value == null) continue;
      String key = Values.key(value);
      keyValues.putIfAbsent(key, value);
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
    }
    if (groups.isEmpty() && table.rowCount() > 0) {
      throw new InvalidInputException("Group column \"" + groupBy + "\" has no values",
          "malformed-group-key", "Every row is missing a value for \"" + groupBy + "\"");
    }

    List<String> labels = uniqueLabels(groupBy, specs);
    List<String> columns = new ArrayList<>();
    columns.add(groupBy);
    columns.addAll(labels);

    List<Map<String, Object>> out = new ArrayList<>(groups.size());
    for (Map.Entry<String, List<Map<String, Object>>> group : groups.entrySet()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(groupBy, keyValues.get(group.getKey()));
      for (int i = 0; i < specs.size(); i++) {
        AggregationSpec spec = specs.get(i);
        List<Object> cells = new ArrayList<>(group.getValue().size());
        for (Map<String, Object> source : group.getValue()) {
          cells.add(source.get(spec.column()));
        }
        row.put(labels.get(i), Aggregations.apply(spec.function(), cells, spec.role()));
      }
      out.add(row);
    }

    if (StringUtils.hasText(request.orderBy())) {
      String sortColumn = sortColumn(request.orderBy(), columns, specs, labels);
      if (sortColumn == null) {
        warnings.add(new OperationWarning(WarningCode.SORT_COLUMN_NOT_FOUND, request.orderBy(),
            "Cannot sort by \"" + request.orderBy() + "\"; result columns are "
                + String.join(", ", columns)));
      } else {
        Rows.sort(out, sortColumn, isDescending(request.orderDirection()));
      }
    }

    warnings.forEach(w -> log.warn("aggregate by {}: {} on {}: {}", groupBy, w.code(),
        w.column(), w.message()));
    log.debug("Aggregated {} rows into {} groups by {} using {}", table.rowCount(), out.size(),
        groupBy, specs);

    Table result = Table.of(columns, out).rounded();
    return new AggregateResult(result, table.rowCount(), result.rowCount(), specs, warnings);
  }

  static boolean isDescending(String direction) {
    if (direction == null) return false;
    String d = direction.trim().toLowerCase(Locale.ROOT);
    return d.equals("desc") || d.equals("descending");
  }

  private static List<String> uniqueLabels(String groupBy, List<AggregationSpec> specs) {
    Set<String> taken = new LinkedHashSet<>();
    taken.add(groupBy);
    List<String> labels = new ArrayList<>(specs.size());
    for (AggregationSpec spec : specs) {
      String label = spec.label();
      int suffix = 2;
      while (taken.contains(label)) {
        label = spec.label() + "_" + suffix++;
      }
      taken.add(label);
      labels.add(label);
    }
    return labels;
  }

  private static String sortColumn(String requested, List<String> columns,
      List<AggregationSpec> specs, List<String> labels) {
    String wanted = requested.trim();
    for (String column : columns) {
      if (column.equalsIgnoreCase(wanted)) return column;
    }
    for (int i = 0; i < specs.size(); i++) {
      if (specs.get(i).column().equalsIgnoreCase(wanted)) return labels.get(i);
    }
    return null;
  }
}
