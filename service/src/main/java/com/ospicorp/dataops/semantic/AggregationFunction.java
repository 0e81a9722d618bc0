package com.ospicorp.dataops.semantic;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.dataops.error.InvalidInputException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public enum AggregationFunction {
  SUM("sum", "sum"),
  MEAN("mean", "avg"),
  MEDIAN("median", "median"),
  MIN("min", "min"),
  MAX("max", "max"),
  COUNT("count", "count"),
  STD("std", "std"),
  VAR("var", "var"),
  P90("p90", "p90"),
  P95("p95", "p95"),
  P99("p99", "p99"),
  ANY("any", "any"),
  ALL("all", "all"),
  COUNT_DISTINCT("count_distinct", "count_distinct");

  private static final Map<String, AggregationFunction> ALIASES = Map.ofEntries(
      Map.entry("avg", MEAN),
      Map.entry("average", MEAN),
      Map.entry("nunique", COUNT_DISTINCT),
      Map.entry("distinct", COUNT_DISTINCT),
      Map.entry("unique", COUNT_DISTINCT),
      Map.entry("stddev", STD),
      Map.entry("std_dev", STD),
      Map.entry("variance", VAR));

  private final String functionName;
  private final String labelPrefix;

  AggregationFunction(String functionName, String labelPrefix) {
    this.functionName = functionName;
    this.labelPrefix = labelPrefix;
  }

  @JsonValue
  public String functionName() {
    return functionName;
  }

  public String labelPrefix() {
    return labelPrefix;
  }

  public Double quantile() {
    return switch (this) {
      case MEDIAN -> 50d;
      case P90 -> 90d;
      case P95 -> 95d;
      case P99 -> 99d;
      default -> null;
    };
  }

  public static AggregationFunction fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidInputException("Aggregation function must be provided",
          "unknown-function", supported());
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    for (AggregationFunction function : values()) {
      if (function.functionName.equals(key)) {
        return function;
      }
    }
    AggregationFunction alias = ALIASES.get(key);
    if (alias == null) {
      throw new InvalidInputException("Unknown aggregation function \"" + name + "\"",
          "unknown-function", supported());
    }
    return alias;
  }

  private static String supported() {
    return "Supported functions: " + Arrays.stream(values())
        .map(AggregationFunction::functionName)
        .collect(Collectors.joining(", "));
  }
}
