package com.ospicorp.dataops.semantic;

import com.ospicorp.dataops.table.DateValues;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.Values;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the {@link ColumnRole} of a column from its name, the names of its siblings and a sample
 * of its values. Classification is a pure function of those inputs: the same column always gets
 * the same role.
 */
public final class ColumnClassifier {
  public static final int DEFAULT_SAMPLE_SIZE = 1000;
  static final double NUMERIC_SHARE = 0.7;
  static final double DATE_SHARE = 0.5;

  static final Set<String> ENTITY_ID_NAMES = Set.of(
      "order_id", "customer_id", "user_id", "product_id", "item_id", "transaction_id",
      "account_id", "employee_id", "invoice_id", "session_id", "client_id", "vendor_id",
      "supplier_id", "store_id", "sku_id", "uuid", "guid");
  static final Set<String> DATE_TOKENS = Set.of(
      "date", "datetime", "timestamp", "time", "month", "year", "week", "quarter", "period", "dt");
  static final List<String> BOOLEAN_PREFIXES = List.of(
      "is_", "has_", "can_", "should_", "was_", "did_", "will_", "allow_", "enable_", "flag_");
  static final Set<String> BOOLEAN_TOKENS = Set.of(
      "true", "false", "1", "0", "yes", "no", "y", "n", "t", "f");
  static final Set<String> MONETARY_TOKENS = Set.of(
      "price", "prices", "cost", "costs", "amount", "amt", "revenue", "revenues", "fee", "fees",
      "total", "sales", "spend", "spending", "salary", "income", "profit", "budget", "payment",
      "payments", "charge", "charges", "tax", "discount", "usd", "eur", "gbp", "inr");
  static final Set<String> RATE_TOKENS = Set.of(
      "rate", "ratio", "percent", "percentage", "pct", "proportion", "share");
  static final Set<String> DERIVED_TOKENS = Set.of(
      "roi", "roas", "ctr", "cvr", "cpc", "cpm", "cpa", "cac", "arpu", "aov", "kpi",
      "efficiency", "productivity", "utilization", "utilisation", "yield", "margin", "per");
  static final Set<String> SUMMARY_NAMES = Set.of("total", "average", "avg", "mean", "median", "sum");
  static final Set<String> BASE_QUANTITY_TOKENS = Set.of(
      "quantity", "qty", "units", "amount", "price", "cost", "count", "volume");

  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
  private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9%]+");

  private final int sampleSize;

  public ColumnClassifier() {
    this(DEFAULT_SAMPLE_SIZE);
  }

  public ColumnClassifier(int sampleSize) {
    if (sampleSize < 1) {
      throw new IllegalArgumentException("sampleSize must be positive");
    }
    this.sampleSize = sampleSize;
  }

  public ColumnRole classify(String name, List<?> values) {
    return classify(name, values, List.of());
  }

  public ColumnRole classify(String name, List<?> values, Collection<String> siblings) {
    List<String> tokens = tokens(name);
    String normalized = String.join("_", tokens);
    List<Object> sample = sample(values);

    if (isIdentifier(normalized, tokens)) return ColumnRole.IDENTIFIER;
    if (isDate(normalized, tokens, sample)) return ColumnRole.DATE;
    if (isBoolean(normalized, sample)) return ColumnRole.BOOLEAN;
    if (containsAny(tokens, MONETARY_TOKENS)) return ColumnRole.MONETARY;
    if (containsAny(tokens, RATE_TOKENS) || name.contains("%")) return ColumnRole.RATE;
    if (isDerived(normalized, tokens, name, siblings)) return ColumnRole.DERIVED;
    if (isNumeric(sample)) return ColumnRole.NUMERIC;
    return ColumnRole.TEXT;
  }

  /** Roles for every column of the table, in column order, each judged against its siblings. */
  public Map<String, ColumnRole> classifyAll(Table table) {
    Map<String, ColumnRole> roles = new LinkedHashMap<>();
    for (String column : table.columns()) {
      roles.put(column, classify(column, table.column(column), table.columns()));
    }
    return roles;
  }

  /** Share of the sampled non-missing values that convert to a number. */
  public double numericShare(List<?> values) {
    List<Object> sample = sample(values);
    if (sample.isEmpty()) return 0d;
    int converted = 0;
    for (Object value : sample) {
      if (!(value instanceof Boolean) && Values.toDouble(value) != null) {
        converted++;
      }
    }
    return (double) converted / sample.size();
  }

  static List<String> tokens(String name) {
    if (name == null) return List.of();
    String split = CAMEL_BOUNDARY.matcher(name.trim()).replaceAll("$1_$2")
        .toLowerCase(Locale.ROOT);
    List<String> tokens = new ArrayList<>();
    for (String token : SEPARATORS.split(split)) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private List<Object> sample(List<?> values) {
    List<Object> sample = new ArrayList<>();
    if (values == null) return sample;
    for (Object value : values) {
      if (value == null || (value instanceof String s && s.isBlank())) continue;
      sample.add(value);
      if (sample.size() >= sampleSize) break;
    }
    return sample;
  }

  private static boolean isIdentifier(String normalized, List<String> tokens) {
    return normalized.equals("id")
        || normalized.endsWith("_id")
        || normalized.contains("_id_")
        || ENTITY_ID_NAMES.contains(normalized)
        || (tokens.size() <= 3 && tokens.contains("id"));
  }

  private static boolean isDate(String normalized, List<String> tokens, List<Object> sample) {
    if (containsAny(tokens, DATE_TOKENS) || normalized.endsWith("_at")) return true;
    if (sample.isEmpty()) return false;
    int candidates = 0;
    int parsed = 0;
    for (Object value : sample) {
      if (value instanceof LocalDate) {
        candidates++;
        parsed++;
      } else if (value instanceof String s) {
        candidates++;
        if (DateValues.parse(s) != null) {
          parsed++;
        }
      }
    }
    if (candidates == 0 || candidates * 2 < sample.size()) return false;
    return parsed >= DATE_SHARE * candidates;
  }

  private static boolean isBoolean(String normalized, List<Object> sample) {
    for (String prefix : BOOLEAN_PREFIXES) {
      if (normalized.startsWith(prefix)) return true;
    }
    if (sample.isEmpty()) return false;
    Set<String> seen = new HashSet<>();
    boolean onlyDigits = true;
    for (Object value : sample) {
      if (value instanceof LocalDate) return false;
      String token = Values.key(value).toLowerCase(Locale.ROOT);
      if (!BOOLEAN_TOKENS.contains(token)) return false;
      seen.add(token);
      if (value instanceof Boolean || !(token.equals("1") || token.equals("0"))) {
        onlyDigits = false;
      }
      if (seen.size() > 2) return false;
    }
    return !onlyDigits || seen.size() == 2;
  }

  private static boolean isDerived(String normalized, List<String> tokens, String name,
      Collection<String> siblings) {
    if (containsAny(tokens, DERIVED_TOKENS)) return true;
    if (!SUMMARY_NAMES.contains(normalized)) return false;
    for (String sibling : siblings) {
      if (!sibling.equals(name) && containsAny(tokens(sibling), BASE_QUANTITY_TOKENS)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isNumeric(List<Object> sample) {
    if (sample.isEmpty()) return false;
    int converted = 0;
    for (Object value : sample) {
      if (Values.isNumber(value) || (value instanceof String s && Values.parseNumber(s) != null)) {
        converted++;
      }
    }
    return converted >= NUMERIC_SHARE * sample.size();
  }

  private static boolean containsAny(List<String> tokens, Set<String> vocabulary) {
    for (String token : tokens) {
      if (vocabulary.contains(token)) return true;
    }
    return false;
  }
}
