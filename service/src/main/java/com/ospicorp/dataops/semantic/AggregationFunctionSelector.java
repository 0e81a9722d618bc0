package com.ospicorp.dataops.semantic;

import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.error.WarningCode;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class AggregationFunctionSelector {
  private static final Set<AggregationFunction> DATE_FUNCTIONS = EnumSet.of(
      AggregationFunction.MIN, AggregationFunction.MAX, AggregationFunction.COUNT,
      AggregationFunction.COUNT_DISTINCT);

  static final Map<String, String> ENTITY_COUNT_LABELS = Map.ofEntries(
      Map.entry("customer", "unique_customers"),
      Map.entry("user", "unique_users"),
      Map.entry("visitor", "unique_visitors"),
      Map.entry("client", "unique_clients"),
      Map.entry("session", "unique_sessions"),
      Map.entry("product", "unique_products"),
      Map.entry("account", "unique_accounts"),
      Map.entry("employee", "unique_employees"),
      Map.entry("patient", "unique_patients"),
      Map.entry("member", "unique_members"),
      Map.entry("vendor", "unique_vendors"),
      Map.entry("supplier", "unique_suppliers"),
      Map.entry("store", "unique_stores"));

  private AggregationFunctionSelector() {
  }

  /**
   * Picks the function and output label for a column. Text columns yield nothing: they are not
   * aggregated at all.
   *
   * @param override caller's explicit choice, or {@code null}
   * @param intent free-text hint scanned for {@link IntentFamily} keywords, or {@code null}
   */
  public static Optional<AggregationSpec> select(String column, ColumnRole role,
      AggregationFunction override, String intent) {
    List<OperationWarning> warnings = new ArrayList<>();
    AggregationFunction function;
    switch (role) {
      case TEXT -> {
        return Optional.empty();
      }
      case IDENTIFIER -> {
        if (override == AggregationFunction.COUNT) {
          function = AggregationFunction.COUNT;
        } else {
          if (override != null && override != AggregationFunction.COUNT_DISTINCT) {
            warnings.add(new OperationWarning(WarningCode.IDENTIFIER_OVERRIDE_REJECTED, column,
                "\"" + column + "\" is an identifier; " + override.functionName()
                    + " is not meaningful for it, counted distinct values instead"));
          }
          function = AggregationFunction.COUNT_DISTINCT;
        }
      }
      case BOOLEAN -> function = override != null ? override : AggregationFunction.ANY;
      case DATE -> {
        if (override != null && !DATE_FUNCTIONS.contains(override)) {
          warnings.add(new OperationWarning(WarningCode.UNSUPPORTED_FUNCTION_FOR_ROLE, column,
              override.functionName() + " cannot be applied to date column \"" + column
                  + "\", using max instead"));
          function = AggregationFunction.MAX;
        } else if (override != null) {
          function = override;
        } else {
          function = IntentFamily.match(intent)
              .filter(DATE_FUNCTIONS::contains)
              .orElse(AggregationFunction.MAX);
        }
      }
      case DERIVED -> {
        function = override != null ? override
            : IntentFamily.match(intent).orElse(AggregationFunction.MEAN);
        warnings.add(new OperationWarning(WarningCode.DERIVED_COLUMN_AGGREGATED, column,
            "\"" + column + "\" looks like a derived metric; aggregating it with "
                + function.functionName()
                + " may mislead, consider aggregating its base components and recomputing"));
      }
      // monetary, rate and numeric take whichever family the intent names
      default -> function = override != null ? override
          : IntentFamily.match(intent).orElse(AggregationFunction.SUM);
    }
    return Optional.of(new AggregationSpec(column, role, function, label(column, role, function),
        warnings));
  }

  public static String label(String column, ColumnRole role, AggregationFunction function) {
    if (role == ColumnRole.IDENTIFIER && function == AggregationFunction.COUNT_DISTINCT) {
      return countLabel(column);
    }
    return switch (function) {
      case SUM -> column + " (Sum)";
      case COUNT -> column + " (Count)";
      default -> function.labelPrefix() + "_" + column;
    };
  }

  /** {@code customer_id} becomes {@code unique_customers}, {@code order_id} {@code order_count}. */
  public static String countLabel(String column) {
    List<String> tokens = new ArrayList<>(ColumnClassifier.tokens(column));
    if (tokens.size() > 1 && tokens.get(tokens.size() - 1).equals("id")) {
      tokens.remove(tokens.size() - 1);
    }
    String base = tokens.isEmpty() ? "id" : String.join("_", tokens);
    String entity = ENTITY_COUNT_LABELS.get(base);
    return entity != null ? entity : base + "_count";
  }
}
