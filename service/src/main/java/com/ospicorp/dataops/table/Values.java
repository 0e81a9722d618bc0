package com.ospicorp.dataops.table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Date;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Conversions between the loosely typed cell values of a {@link Table} and the numeric, boolean
 * and key forms the engine computes on.
 */
public final class Values {
  private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
  private static final Pattern STRIPPED = Pattern.compile("[,$€£¥₹%\\s]");
  private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y", "t");
  private static final Set<String> FALSY = Set.of("false", "0", "no", "n", "f");
  private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
  private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

  /** Missing values last, numbers before dates, dates before booleans, strings at the end. */
  public static final Comparator<Object> ORDERING = Values::compare;

  private Values() {
  }

  public static Object normalize(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Long || raw instanceof Boolean || raw instanceof String
        || raw instanceof LocalDate) {
      return raw;
    }
    if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return ((Number) raw).longValue();
    }
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    if (raw instanceof BigInteger big) {
      return big.bitLength() < 64 ? (Object) big.longValue() : (Object) big.doubleValue();
    }
    if (raw instanceof BigDecimal dec) {
      if (dec.signum() == 0 || dec.stripTrailingZeros().scale() <= 0) {
        if (dec.compareTo(LONG_MIN) >= 0 && dec.compareTo(LONG_MAX) <= 0) {
          return dec.longValue();
        }
      }
      return dec.doubleValue();
    }
    if (raw instanceof Number n) {
      return n.doubleValue();
    }
    if (raw instanceof LocalDateTime ldt) return ldt.toLocalDate();
    if (raw instanceof OffsetDateTime odt) return odt.toLocalDate();
    if (raw instanceof ZonedDateTime zdt) return zdt.toLocalDate();
    if (raw instanceof Date date) return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    if (raw instanceof CharSequence cs) return cs.toString();
    return raw.toString();
  }

  public static boolean isMissing(Object value) {
    return value == null;
  }

  public static boolean isNumber(Object value) {
    return value instanceof Long || value instanceof Double;
  }

  public static Double toDouble(Object value) {
    if (value == null) return null;
    if (value instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? d : null;
    }
    if (value instanceof Boolean b) return b ? 1d : 0d;
    if (value instanceof String s) return parseNumber(s);
    return null;
  }

  /**
   * Parses a number after stripping thousands separators, currency symbols and percent signs.
   * Accounting negatives such as {@code (1,200)} read as -1200.
   */
  public static Double parseNumber(String text) {
    if (text == null) return null;
    String s = text.trim();
    boolean negative = false;
    if (s.length() > 2 && s.startsWith("(") && s.endsWith(")")) {
      negative = true;
      s = s.substring(1, s.length() - 1);
    }
    s = STRIPPED.matcher(s).replaceAll("");
    if (s.isEmpty() || !NUMBER.matcher(s).matches()) return null;
    double d = Double.parseDouble(s);
    return negative ? -d : d;
  }

  public static Boolean toBoolean(Object value) {
    if (value == null) return null;
    if (value instanceof Boolean b) return b;
    if (value instanceof Number n) return n.doubleValue() != 0d;
    String s = value.toString().trim().toLowerCase(Locale.ROOT);
    if (TRUTHY.contains(s)) return true;
    if (FALSY.contains(s)) return false;
    return !s.isEmpty();
  }

  /** String form used to compare values for grouping and distinct counting. */
  public static String key(Object value) {
    if (value == null) return null;
    if (value instanceof Double d) {
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    if (value instanceof String s) return s.trim();
    return value.toString();
  }

  public static double round(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  public static Double round(Double value) {
    if (value == null || !Double.isFinite(value)) return null;
    return round(value.doubleValue());
  }

  /** Rounds floating values to two decimals and leaves every other kind untouched. */
  public static Object roundCell(Object value) {
    if (value instanceof Double d) return round(d);
    return value;
  }

  /** Collapses an all-integral double result back to an integer so integers stay exact. */
  public static Object numberResult(double value, boolean integral) {
    if (integral && value == Math.rint(value) && Math.abs(value) < 9.0e15) {
      return (long) value;
    }
    return value;
  }

  public static String kind(Object value) {
    if (value == null) return "missing";
    if (value instanceof Boolean) return "boolean";
    if (value instanceof Long) return "integer";
    if (value instanceof Double) return "float";
    if (value instanceof LocalDate) return "date";
    return "string";
  }

  public static int compare(Object a, Object b) {
    if (a == null || b == null) {
      if (a == b) return 0;
      return a == null ? 1 : -1;
    }
    int rankA = rank(a);
    int rankB = rank(b);
    if (rankA != rankB) return Integer.compare(rankA, rankB);
    return switch (rankA) {
      case 0 -> Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
      case 1 -> ((LocalDate) a).compareTo((LocalDate) b);
      case 2 -> Boolean.compare((Boolean) a, (Boolean) b);
      default -> a.toString().compareTo(b.toString());
    };
  }

  private static int rank(Object value) {
    if (value instanceof Number) return 0;
    if (value instanceof LocalDate) return 1;
    if (value instanceof Boolean) return 2;
    return 3;
  }
}
