package com.ospicorp.dataops.ops;

import com.ospicorp.dataops.semantic.AggregationFunction;
import com.ospicorp.dataops.semantic.ColumnRole;
import com.ospicorp.dataops.table.DateValues;
import com.ospicorp.dataops.table.Values;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Evaluates one {@link AggregationFunction} over the cells of a group. Missing cells are ignored;
 * a function with no non-missing input yields a missing result.
 */
public final class Aggregations {
  private Aggregations() {
  }

  public static Object apply(AggregationFunction function, List<Object> cells, ColumnRole role) {
    switch (function) {
      case COUNT -> {
        long count = 0;
        for (Object cell : cells) {
          if (cell != null) count++;
        }
        return count;
      }
      case COUNT_DISTINCT -> {
        Set<String> distinct = new HashSet<>();
        for (Object cell : cells) {
          if (cell != null) distinct.add(Values.key(cell));
        }
        return (long) distinct.size();
      }
      case ANY, ALL -> {
        return truthiness(function, cells);
      }
      default -> {
        if (role == ColumnRole.DATE) {
          return dateExtreme(function, cells);
        }
        return numeric(function, cells);
      }
    }
  }

  /** Linear-interpolated quantile (numpy's default), {@code p} in percent. */
  public static double quantile(double[] values, double p) {
    if (values.length == 1) return values[0];
    return new Percentile().withEstimationType(Percentile.EstimationType.R_7)
        .evaluate(values, p);
  }

  public static double sampleStd(double[] values) {
    return Math.sqrt(StatUtils.variance(values));
  }

  private static Object numeric(AggregationFunction function, List<Object> cells) {
    List<Double> numbers = new ArrayList<>(cells.size());
    boolean integral = true;
    for (Object cell : cells) {
      Double d = Values.toDouble(cell);
      if (d != null) {
        numbers.add(d);
        integral &= cell instanceof Long;
      }
    }
    if (numbers.isEmpty()) return null;
    double[] values = new double[numbers.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = numbers.get(i);
    }
    return switch (function) {
      case SUM -> Values.numberResult(StatUtils.sum(values), integral);
      case MEAN -> StatUtils.mean(values);
      case MIN -> Values.numberResult(StatUtils.min(values), integral);
      case MAX -> Values.numberResult(StatUtils.max(values), integral);
      case STD -> values.length < 2 ? null : sampleStd(values);
      case VAR -> values.length < 2 ? null : StatUtils.variance(values);
      case MEDIAN, P90, P95, P99 -> quantile(values, function.quantile());
      default -> throw new IllegalStateException("Not a numeric function: " + function);
    };
  }

  private static Object truthiness(AggregationFunction function, List<Object> cells) {
    boolean seen = false;
    for (Object cell : cells) {
      Boolean b = Values.toBoolean(cell);
      if (b == null) continue;
      seen = true;
      if (function == AggregationFunction.ANY && b) return true;
      if (function == AggregationFunction.ALL && !b) return false;
    }
    if (!seen) return null;
    return function == AggregationFunction.ALL;
  }

  private static Object dateExtreme(AggregationFunction function, List<Object> cells) {
    LocalDate best = null;
    for (Object cell : cells) {
      LocalDate date = DateValues.toDate(cell);
      if (date == null) continue;
      if (best == null
          || (function == AggregationFunction.MIN ? date.isBefore(best) : date.isAfter(best))) {
        best = date;
      }
    }
    return best;
  }
}
