package com.ospicorp.dataops.table;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValuesTest {

  @Test
  void parseNumberStripsCurrencyAndSeparators() {
    assertEquals(1234.5, Values.parseNumber("$1,234.50"));
    assertEquals(12d, Values.parseNumber("12%"));
    assertEquals(-1200d, Values.parseNumber("(1,200)"));
    assertEquals(99d, Values.parseNumber(" € 99 "));
    assertNull(Values.parseNumber("abc"));
    assertNull(Values.parseNumber(""));
  }

  @Test
  void normalizeCollapsesNumberTypes() {
    assertEquals(3L, Values.normalize(3));
    assertEquals(4L, Values.normalize(new BigDecimal("4.00")));
    assertEquals(4.5, Values.normalize(new BigDecimal("4.5")));
    assertNull(Values.normalize(Double.NaN));
    assertNull(Values.normalize(Double.POSITIVE_INFINITY));
  }

  @Test
  void keyRendersIntegralDoublesWithoutFraction() {
    assertEquals("5", Values.key(5.0));
    assertEquals("2.5", Values.key(2.50));
    assertEquals("a", Values.key("  a "));
    assertEquals("true", Values.key(true));
  }

  @Test
  void roundingIsHalfUpAndIdempotent() {
    assertEquals(2.35, Values.round(2.345));
    assertEquals(Values.round(2.345), Values.round(Values.round(2.345)));
    assertEquals(7L, Values.roundCell(7L));
    assertNull(Values.round(Double.valueOf(Double.NaN)));
  }

  @Test
  void orderingPutsMissingLastAndNumbersBeforeStrings() {
    List<Object> values = new ArrayList<>(Arrays.asList(null, "b", 3L, 1.5, "a"));
    values.sort(Values.ORDERING);
    assertEquals(Arrays.asList(1.5, 3L, "a", "b", null), values);
  }

  @Test
  void toDoubleReadsBooleansAsOneAndZero() {
    assertEquals(1d, Values.toDouble(true));
    assertEquals(0d, Values.toDouble(false));
    assertEquals(10d, Values.toDouble("10"));
    assertNull(Values.toDouble(null));
  }
}
