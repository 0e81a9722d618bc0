package com.ospicorp.dataops.table;

import static com.ospicorp.dataops.table.TestTables.row;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TableTest {

  @Test
  void columnsAreUnionInFirstAppearanceOrder() {
    Table table = TestTables.table(row("a", 1, "b", 2), row("c", 3, "a", 4));
    assertEquals(List.of("a", "b", "c"), table.columns());
    assertNull(table.get(0, "c"));
    assertNull(table.get(1, "b"));
    assertEquals(4L, table.get(1, "a"));
  }

  @Test
  void inputRowsAreCopied() {
    List<Map<String, Object>> input = new ArrayList<>();
    input.add(row("x", 1));
    Table table = Table.of(input);
    input.get(0).put("x", 99);
    assertEquals(1L, table.get(0, "x"));
    assertThrows(UnsupportedOperationException.class, () -> table.rows().get(0).put("x", 2L));
  }

  @Test
  void withoutRowsKeepsOrderOfTheRest() {
    Table table = TestTables.column("v", 1, 2, 3, 4);
    Table kept = table.withoutRows(Set.of(0, 2));
    assertEquals(List.of(2L, 4L), kept.column("v"));
    assertEquals(4, table.rowCount());
  }

  @Test
  void roundedOnlyTouchesFloatingCells() {
    Table table = TestTables.table(row("a", 1.005, "b", 7, "c", "x"));
    Table rounded = table.rounded();
    assertEquals(1.01, rounded.get(0, "a"));
    assertEquals(7L, rounded.get(0, "b"));
    assertEquals("x", rounded.get(0, "c"));
  }
}
