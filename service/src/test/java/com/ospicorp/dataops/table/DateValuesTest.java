package com.ospicorp.dataops.table;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DateValuesTest {

  @Test
  void isoFormsParse() {
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("2024-01-15"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("2024-01-15T10:30:00"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("2024-01-15T10:30:00Z"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("2024-01-15 10:30"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("2024/01/15"));
  }

  @Test
  void ambiguousDayMonthReadsDayFirst() {
    assertEquals(LocalDate.of(2024, 4, 3), DateValues.parse("03/04/2024"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("15/01/2024"));
    assertEquals(LocalDate.of(2024, 1, 13), DateValues.parse("01-13-2024"));
  }

  @Test
  void monthYearFormsUseFirstOfMonth() {
    assertEquals(LocalDate.of(2023, 4, 1), DateValues.parse("Apr-23"));
    assertEquals(LocalDate.of(2024, 1, 1), DateValues.parse("January 2024"));
    assertEquals(LocalDate.of(2020, 11, 1), DateValues.parse("11-2020"));
  }

  @Test
  void namedMonthWithDayParses() {
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("15 Jan 2024"));
    assertEquals(LocalDate.of(2024, 1, 15), DateValues.parse("Jan 15, 2024"));
  }

  @Test
  void twoDigitYearsPivotAtFifty() {
    assertEquals(2049, DateValues.fullYear("49"));
    assertEquals(1950, DateValues.fullYear("50"));
    assertEquals(1999, DateValues.fullYear("99"));
  }

  @Test
  void garbageIsNotADate() {
    assertNull(DateValues.parse("hello"));
    assertNull(DateValues.parse("13/13/2024"));
    assertNull(DateValues.parse("W1"));
    assertNull(DateValues.parse(null));
  }
}
