package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.error.WarningCode;
import com.ospicorp.dataops.semantic.AggregationFunction;
import com.ospicorp.dataops.semantic.AggregationFunctionSelector;
import com.ospicorp.dataops.semantic.AggregationSpec;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.semantic.ColumnRole;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Spreads the distinct values of an index column into output columns named
 * {@code <value column>_<index value>} (identifier columns use their count label instead of the
 * column name), one row per combination of the preserved text/date/boolean columns.
 *
 * <p>The index column itself cannot survive the reshape, so every output row gets a
 * reconstructed value: the index value whose cell holds the largest non-zero number in that
 * row, ties going to the index value seen first. When no such cell exists the first source row
 * with the same preserved values supplies it, and failing that the first index value overall.
 * This is a best-effort guess, not an inverse, and every result carries a
 * {@link WarningCode#PIVOT_INDEX_RECONSTRUCTED} warning saying so.
 */
@Service
public class PivotReshaper {
  private static final Logger log = LoggerFactory.getLogger(PivotReshaper.class);
  private static final Set<ColumnRole> DIMENSION_ROLES =
      EnumSet.of(ColumnRole.TEXT, ColumnRole.DATE, ColumnRole.BOOLEAN);

  private final ColumnClassifier classifier;
  private final int maxOutputColumns;

  public PivotReshaper(ColumnClassifier classifier,
      @Value("${dataops.pivot.max-output-columns:1000}") int maxOutputColumns) {
    this.classifier = classifier;
    this.maxOutputColumns = maxOutputColumns;
  }

  private record PivotColumn(String name, AggregationSpec spec, String indexKey, int indexOrder) {}

  public PivotResult pivot(Table table, PivotRequest request) {
    String index = request.indexColumn();
    if (!StringUtils.hasText(index)) {
      throw new InvalidInputException("Index column must be provided", "missing-index-column",
          "Available columns: " + String.join(", ", table.columns()));
    }
    if (!table.hasColumn(index)) {
      throw InvalidInputException.unknownColumn(index, table.columns());
    }

    Map<String, ColumnRole> roles = classifier.classifyAll(table);
    List<OperationWarning> warnings = new ArrayList<>();
    List<AggregationSpec> specs = ValueColumns.resolve(classifier, table, roles,
        request.valueColumns(), index, request.functions(), null, warnings);
    specs = distinctIdentifiers(specs, warnings);

    Set<String> valueColumns = new HashSet<>();
    specs.forEach(spec -> valueColumns.add(spec.column()));
    List<String> preserved = new ArrayList<>();
    for (String column : table.columns()) {
      if (!column.equals(index) && !valueColumns.contains(column)
          && DIMENSION_ROLES.contains(roles.get(column))) {
        preserved.add(column);
      }
    }

    Map<String, Object> indexValues = new LinkedHashMap<>();
    for (Map<String, Object> row : table.rows()) {
      Object value = row.get(index);
      if (value != null) {
        indexValues.putIfAbsent(Values.key(value), value);
      }
    }
    if (indexValues.isEmpty() && table.rowCount() > 0) {
      throw new InvalidInputException("Index column \"" + index + "\" has no values",
          "malformed-index-column", "Every row is missing a value for \"" + index + "\"");
    }

    long estimatedColumns = 1L + preserved.size() + (long) specs.size() * indexValues.size();
    if (estimatedColumns > maxOutputColumns) {
      warnings.add(new OperationWarning(WarningCode.PIVOT_SIZE, index,
          "Pivot on \"" + index + "\" produces about " + estimatedColumns
              + " columns, more than the " + maxOutputColumns + " recommended"));
    }

    List<PivotColumn> pivotColumns = pivotColumns(specs, indexValues, preserved, index);
    Map<List<String>, Map<String, List<Map<String, Object>>>> cells = new LinkedHashMap<>();
    Map<List<String>, Map<String, Object>> preservedValues = new LinkedHashMap<>();
    Map<List<String>, Object> firstIndexValues = new HashMap<>();
    for (Map<String, Object> row : table.rows()) {
      Object indexValue = row.get(index);
      List<String> groupKey = groupKey(row, preserved);
      if (indexValue == null || groupKey == null) continue;
      preservedValues.computeIfAbsent(groupKey, k -> {
        Map<String, Object> values = new LinkedHashMap<>();
        preserved.forEach(column -> values.put(column, row.get(column)));
        return values;
      });
      firstIndexValues.putIfAbsent(groupKey, indexValue);
      cells.computeIfAbsent(groupKey, k -> new LinkedHashMap<>())
          .computeIfAbsent(Values.key(indexValue), k -> new ArrayList<>())
          .add(row);
    }

    List<Map<String, Object>> out = new ArrayList<>(cells.size());
    for (Map.Entry<List<String>, Map<String, List<Map<String, Object>>>> group : cells.entrySet()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put(index, null);
      row.putAll(preservedValues.get(group.getKey()));
      boolean anyCell = false;
      for (PivotColumn column : pivotColumns) {
        List<Map<String, Object>> rows = group.getValue().get(column.indexKey());
        Object value = null;
        if (rows != null) {
          List<Object> values = new ArrayList<>(rows.size());
          rows.forEach(source -> values.add(source.get(column.spec().column())));
          value = Aggregations.apply(column.spec().function(), values, column.spec().role());
        }
        anyCell |= value != null;
        row.put(column.name(), value);
      }
      if (!anyCell) continue;
      Object fallback = firstIndexValues.get(group.getKey());
      if (fallback == null) {
        fallback = indexValues.values().iterator().next();
      }
      row.put(index, reconstructIndex(row, pivotColumns, indexValues, fallback));
      out.add(row);
    }

    Rows.sort(out, index, false);
    if (!out.isEmpty()) {
      warnings.add(new OperationWarning(WarningCode.PIVOT_INDEX_RECONSTRUCTED, index,
          "Values in \"" + index + "\" are a best-effort reconstruction: each row shows the "
              + index + " with the largest aggregated value, not an exact inverse of the pivot"));
    }

    List<String> columns = new ArrayList<>();
    columns.add(index);
    columns.addAll(preserved);
    pivotColumns.forEach(column -> columns.add(column.name()));

    warnings.forEach(w -> log.warn("pivot on {}: {} on {}: {}", index, w.code(), w.column(),
        w.message()));
    log.debug("Pivoted {} rows on {} into {} rows x {} columns", table.rowCount(), index,
        out.size(), columns.size());

    Table result = Table.of(columns, out).rounded();
    return new PivotResult(result, table.rowCount(), result.rowCount(), List.copyOf(preserved),
        specs, warnings);
  }

  private static List<PivotColumn> pivotColumns(List<AggregationSpec> specs,
      Map<String, Object> indexValues, List<String> preserved, String index) {
    Set<String> taken = new HashSet<>(preserved);
    taken.add(index);
    List<PivotColumn> columns = new ArrayList<>();
    for (AggregationSpec spec : specs) {
      String prefix = spec.role() == ColumnRole.IDENTIFIER ? spec.label() : spec.column();
      int order = 0;
      for (String key : indexValues.keySet()) {
        String base = prefix + "_" + key.replaceAll("\\s", "_");
        String name = base;
        int suffix = 2;
        while (taken.contains(name)) {
          name = base + "_" + suffix++;
        }
        taken.add(name);
        columns.add(new PivotColumn(name, spec, key, order++));
      }
    }
    return columns;
  }

  /** Preserved-column key of a row, or {@code null} when one of them is missing. */
  private static List<String> groupKey(Map<String, Object> row, List<String> preserved) {
    List<String> key = new ArrayList<>(preserved.size());
    for (String column : preserved) {
      Object value = row.get(column);
      if (value == null) return null;
      key.add(Values.key(value));
    }
    return key;
  }

  /** Pivot cells of identifiers always count distinct values, whatever was requested. */
  private static List<AggregationSpec> distinctIdentifiers(List<AggregationSpec> specs,
      List<OperationWarning> warnings) {
    List<AggregationSpec> out = new ArrayList<>(specs.size());
    for (AggregationSpec spec : specs) {
      if (spec.role() != ColumnRole.IDENTIFIER
          || spec.function() == AggregationFunction.COUNT_DISTINCT) {
        out.add(spec);
        continue;
      }
      OperationWarning warning = new OperationWarning(WarningCode.IDENTIFIER_OVERRIDE_REJECTED,
          spec.column(), "\"" + spec.column() + "\" is an identifier; pivot cells count its "
              + "distinct values instead of " + spec.function().functionName());
      warnings.add(warning);
      out.add(new AggregationSpec(spec.column(), spec.role(), AggregationFunction.COUNT_DISTINCT,
          AggregationFunctionSelector.label(spec.column(), spec.role(),
              AggregationFunction.COUNT_DISTINCT),
          List.of(warning)));
    }
    return out;
  }

  private static Object reconstructIndex(Map<String, Object> row, List<PivotColumn> pivotColumns,
      Map<String, Object> indexValues, Object fallback) {
    PivotColumn best = null;
    double bestValue = 0d;
    for (PivotColumn column : pivotColumns) {
      Double value = Values.toDouble(row.get(column.name()));
      if (value == null || value == 0d) continue;
      if (best == null || value > bestValue
          || (value == bestValue && column.indexOrder() < best.indexOrder())) {
        best = column;
        bestValue = value;
      }
    }
    return best != null ? indexValues.get(best.indexKey()) : fallback;
  }
}
