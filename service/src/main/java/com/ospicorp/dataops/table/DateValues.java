package com.ospicorp.dataops.table;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient date parsing for string cells. Month-year forms resolve to the first of the month and
 * two-digit years pivot into 1950-2049.
 */
public final class DateValues {
  private static final Pattern YEAR_FIRST =
      Pattern.compile("^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})$");
  private static final Pattern YEAR_LAST =
      Pattern.compile("^(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{2}|\\d{4})$");
  private static final Pattern NUMERIC_MONTH_YEAR = Pattern.compile("^(\\d{1,2})[-/](\\d{2}|\\d{4})$");
  private static final Pattern NAMED_MONTH_YEAR =
      Pattern.compile("^([A-Za-z]{3,9})[-\\s/']?(\\d{2}|\\d{4})$");
  private static final Pattern DAY_NAMED_MONTH_YEAR =
      Pattern.compile("^(\\d{1,2})[-\\s]([A-Za-z]{3,9})[-\\s,]+(\\d{2}|\\d{4})$");
  private static final Pattern NAMED_MONTH_DAY_YEAR =
      Pattern.compile("^([A-Za-z]{3,9})\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})$");
  private static final DateTimeFormatter SPACED_DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

  private static final Map<String, Integer> MONTHS = Map.ofEntries(
      Map.entry("jan", 1), Map.entry("january", 1),
      Map.entry("feb", 2), Map.entry("february", 2),
      Map.entry("mar", 3), Map.entry("march", 3),
      Map.entry("apr", 4), Map.entry("april", 4),
      Map.entry("may", 5),
      Map.entry("jun", 6), Map.entry("june", 6),
      Map.entry("jul", 7), Map.entry("july", 7),
      Map.entry("aug", 8), Map.entry("august", 8),
      Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
      Map.entry("oct", 10), Map.entry("october", 10),
      Map.entry("nov", 11), Map.entry("november", 11),
      Map.entry("dec", 12), Map.entry("december", 12));

  private DateValues() {
  }

  public static LocalDate toDate(Object value) {
    if (value instanceof LocalDate date) return date;
    if (value instanceof String s) return parse(s);
    return null;
  }

  public static LocalDate parse(String text) {
    if (text == null) return null;
    String s = text.trim();
    if (s.length() < 4) return null;

    LocalDate iso = parseIso(s);
    if (iso != null) return iso;

    Matcher m = YEAR_FIRST.matcher(s);
    if (m.matches()) {
      return date(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
          Integer.parseInt(m.group(3)));
    }

    m = YEAR_LAST.matcher(s);
    if (m.matches()) {
      int first = Integer.parseInt(m.group(1));
      int second = Integer.parseInt(m.group(2));
      int year = fullYear(m.group(3));
      if (first > 12) return date(year, second, first);
      if (second > 12) return date(year, first, second);
      return date(year, second, first);
    }

    m = NUMERIC_MONTH_YEAR.matcher(s);
    if (m.matches()) {
      return date(fullYear(m.group(2)), Integer.parseInt(m.group(1)), 1);
    }

    m = NAMED_MONTH_YEAR.matcher(s);
    if (m.matches()) {
      Integer month = month(m.group(1));
      return month == null ? null : date(fullYear(m.group(2)), month, 1);
    }

    m = DAY_NAMED_MONTH_YEAR.matcher(s);
    if (m.matches()) {
      Integer month = month(m.group(2));
      return month == null ? null
          : date(fullYear(m.group(3)), month, Integer.parseInt(m.group(1)));
    }

    m = NAMED_MONTH_DAY_YEAR.matcher(s);
    if (m.matches()) {
      Integer month = month(m.group(1));
      return month == null ? null
          : date(Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(2)));
    }
    return null;
  }

  /** Two-digit years below 50 land in the 2000s, the rest in the 1900s. */
  static int fullYear(String digits) {
    int year = Integer.parseInt(digits);
    if (digits.length() > 2) return year;
    return year < 50 ? 2000 + year : 1900 + year;
  }

  private static LocalDate parseIso(String s) {
    if (!Character.isDigit(s.charAt(0)) || s.length() < 10 || s.charAt(4) != '-') return null;
    try {
      if (s.length() == 10) return LocalDate.parse(s);
      if (s.indexOf('T') == 10) {
        if (s.endsWith("Z") || s.lastIndexOf('+') > 10 || s.lastIndexOf('-') > 10) {
          return OffsetDateTime.parse(s).toLocalDate();
        }
        return LocalDateTime.parse(s).toLocalDate();
      }
      return LocalDateTime.parse(s, SPACED_DATE_TIME).toLocalDate();
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  private static Integer month(String name) {
    return MONTHS.get(name.toLowerCase(Locale.ROOT));
  }

  private static LocalDate date(int year, int month, int day) {
    if (year < 1000 || year > 9999) return null;
    try {
      return LocalDate.of(year, month, day);
    } catch (DateTimeException ex) {
      return null;
    }
  }
}
