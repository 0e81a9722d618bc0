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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/** Turns the requested (or auto-detected) value columns into aggregation specs. */
final class ValueColumns {
  private ValueColumns() {
  }

  static List<AggregationSpec> resolve(ColumnClassifier classifier, Table table,
      Map<String, ColumnRole> roles, List<String> requested, String keyColumn,
      Map<String, String> overrides, String intent, List<OperationWarning> warnings) {

    boolean explicit = requested != null && !requested.isEmpty();
    Set<String> candidates = new LinkedHashSet<>();
    if (explicit) {
      for (String column : requested) {
        if (!table.hasColumn(column)) {
          throw InvalidInputException.unknownColumn(column, table.columns());
        }
        if (!column.equals(keyColumn)) {
          candidates.add(column);
        }
      }
    } else {
      for (String column : table.columns()) {
        if (!column.equals(keyColumn)) {
          candidates.add(column);
        }
      }
    }

    Map<String, AggregationFunction> functions = parseOverrides(table, overrides);
    List<AggregationSpec> specs = new ArrayList<>();
    for (String column : candidates) {
      ColumnRole role = roles.get(column);
      if (role == ColumnRole.TEXT) {
        if (!explicit) continue;
        if (classifier.numericShare(table.column(column)) == 0d) {
          warnings.add(new OperationWarning(WarningCode.TEXT_COLUMN_DROPPED, column,
              "\"" + column + "\" holds text with no numeric values and was left out"));
          continue;
        }
        role = ColumnRole.NUMERIC;
      }
      if (role == ColumnRole.DATE && !explicit) continue;

      AggregationSpec spec = AggregationFunctionSelector
          .select(column, role, functions.get(column), intent)
          .orElse(null);
      if (spec != null) {
        specs.add(spec);
        warnings.addAll(spec.warnings());
      }
    }

    if (specs.isEmpty()) {
      throw new InvalidInputException(
          "No columns left to aggregate after excluding \"" + keyColumn + "\"",
          "no-value-columns",
          "Detected columns by role: " + roleCounts(roles, keyColumn)
              + ". Text and date columns are only aggregated when requested explicitly.");
    }
    return specs;
  }

  private static Map<String, AggregationFunction> parseOverrides(Table table,
      Map<String, String> overrides) {
    Map<String, AggregationFunction> functions = new HashMap<>();
    if (overrides == null) return functions;
    for (Map.Entry<String, String> entry : overrides.entrySet()) {
      String column = matchColumn(table, entry.getKey());
      if (column == null) {
        throw InvalidInputException.unknownColumn(entry.getKey(), table.columns());
      }
      functions.put(column, AggregationFunction.fromName(entry.getValue()));
    }
    return functions;
  }

  /** Exact name first, then a case-insensitive match. */
  static String matchColumn(Table table, String name) {
    if (name == null) return null;
    if (table.hasColumn(name)) return name;
    String lower = name.trim().toLowerCase(Locale.ROOT);
    for (String column : table.columns()) {
      if (column.toLowerCase(Locale.ROOT).equals(lower)) {
        return column;
      }
    }
    return null;
  }

  static String roleCounts(Map<String, ColumnRole> roles, String keyColumn) {
    Map<ColumnRole, Integer> counts = new EnumMap<>(ColumnRole.class);
    for (ColumnRole role : ColumnRole.values()) {
      counts.put(role, 0);
    }
    roles.forEach((column, role) -> {
      if (!column.equals(keyColumn)) {
        counts.merge(role, 1, Integer::sum);
      }
    });
    return counts.entrySet().stream()
        .map(e -> e.getKey().label() + "=" + e.getValue())
        .collect(Collectors.joining(", "));
  }
}
