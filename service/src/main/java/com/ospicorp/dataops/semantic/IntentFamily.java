package com.ospicorp.dataops.semantic;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword families recognized in free-text intent hints. Constants are evaluated in declaration
 * order and the first family whose pattern occurs in the hint decides the function. Percentiles
 * come before {@link #MAX} so "top 5%" is not read as a plain "top".
 */
public enum IntentFamily {
  MEAN("\\baverages?\\b|\\bavg\\b|\\bmean\\b|\\btypical\\b", AggregationFunction.MEAN),
  MEDIAN("\\bmedian\\b|\\bwithout\\s+outliers\\b|\\bmiddle\\s+value\\b", AggregationFunction.MEDIAN),
  PERCENTILE("\\bp(90|95|99)\\b|\\b(90|95|99)(?:th)?\\s*percentile\\b|\\btop\\s*(10|5|1)\\s*%|\\bpercentiles?\\b",
      AggregationFunction.P95) {
    @Override
    AggregationFunction resolve(Matcher matcher) {
      String level = firstNonNull(matcher.group(1), matcher.group(2));
      if (level != null) {
        return switch (level) {
          case "90" -> AggregationFunction.P90;
          case "99" -> AggregationFunction.P99;
          default -> AggregationFunction.P95;
        };
      }
      String top = matcher.group(3);
      if (top != null) {
        return switch (top) {
          case "10" -> AggregationFunction.P90;
          case "1" -> AggregationFunction.P99;
          default -> AggregationFunction.P95;
        };
      }
      return AggregationFunction.P95;
    }
  },
  MAX("\\bhighest\\b|\\bmax\\b|\\bmaximum\\b|\\btop\\b|\\blargest\\b|\\bbiggest\\b|\\bpeak\\b",
      AggregationFunction.MAX),
  MIN("\\blowest\\b|\\bmin\\b|\\bminimum\\b|\\bbottom\\b|\\bsmallest\\b|\\bleast\\b",
      AggregationFunction.MIN),
  VARIANCE("\\bvariance\\b", AggregationFunction.VAR),
  STD("\\bstd\\b|\\bstddev\\b|\\bstandard\\s+deviation\\b|\\bspread\\b|\\bvolatility\\b",
      AggregationFunction.STD);

  private final Pattern pattern;
  private final AggregationFunction function;

  IntentFamily(String regex, AggregationFunction function) {
    this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    this.function = function;
  }

  AggregationFunction resolve(Matcher matcher) {
    return function;
  }

  /** Function requested by the first family found in the hint, if any. */
  public static Optional<AggregationFunction> match(String intent) {
    if (intent == null || intent.isBlank()) {
      return Optional.empty();
    }
    for (IntentFamily family : values()) {
      Matcher matcher = family.pattern.matcher(intent);
      if (matcher.find()) {
        return Optional.of(family.resolve(matcher));
      }
    }
    return Optional.empty();
  }

  private static String firstNonNull(String a, String b) {
    return a != null ? a : b;
  }
}
