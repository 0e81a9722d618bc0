package com.ospicorp.dataops.ops;

import static com.ospicorp.dataops.table.TestTables.row;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.error.WarningCode;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.TestTables;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PivotReshaperTest {
  private final ColumnClassifier classifier = new ColumnClassifier();
  private final PivotReshaper reshaper = new PivotReshaper(classifier, 1000);

  private static Table weekly() {
    return TestTables.table(
        row("week", "W1", "status", "Done", "sales", 100),
        row("week", "W1", "status", "Open", "sales", 50),
        row("week", "W2", "status", "Open", "sales", 70),
        row("week", "W2", "status", "Done", "sales", 70),
        row("week", "W3", "status", "Open", "sales", 20));
  }

  @Test
  void spreadsIndexValuesAndReconstructsIndex() {
    Table table = TestTables.table(
        row("week", "W1", "status", "Done", "sales", 100),
        row("week", "W1", "status", "Open", "sales", 50));
    var result = reshaper.pivot(table, new PivotRequest("status", null, null));

    assertEquals(List.of("status", "week", "sales_Done", "sales_Open"), result.data().columns());
    assertEquals(List.of("week"), result.preservedColumns());
    assertEquals(1, result.rowsAfter());
    assertEquals("Done", result.data().get(0, "status"));
    assertEquals("W1", result.data().get(0, "week"));
    assertEquals(100L, result.data().get(0, "sales_Done"));
    assertEquals(50L, result.data().get(0, "sales_Open"));
  }

  @Test
  void tiesGoToFirstIndexValueSeen() {
    var result = reshaper.pivot(weekly(), new PivotRequest("status", null, null));

    assertEquals(3, result.rowsAfter());
    assertEquals("W2", result.data().get(1, "week"));
    assertEquals("Done", result.data().get(1, "status"));
  }

  @Test
  void missingCombinationsStayMissingAndRowsSortByIndex() {
    var result = reshaper.pivot(weekly(), new PivotRequest("status", null, null));

    var last = result.data().rows().get(2);
    assertEquals("W3", last.get("week"));
    assertEquals("Open", last.get("status"));
    assertNull(last.get("sales_Done"));
    assertEquals(20L, last.get("sales_Open"));
  }

  @Test
  void pivotTotalsMatchGroupAggregation() {
    var pivot = reshaper.pivot(weekly(), new PivotRequest("status", List.of("sales"), null));
    var aggregate = new GroupAggregator(classifier)
        .aggregate(weekly(), AggregateRequest.groupBy("status", List.of("sales")));

    long done = 0;
    long open = 0;
    for (var row : pivot.data().rows()) {
      done += row.get("sales_Done") == null ? 0 : (Long) row.get("sales_Done");
      open += row.get("sales_Open") == null ? 0 : (Long) row.get("sales_Open");
    }
    assertEquals(aggregate.data().get(0, "sales (Sum)"), done);
    assertEquals(aggregate.data().get(1, "sales (Sum)"), open);
  }

  @Test
  void everyResultCarriesReconstructionWarning() {
    var result = reshaper.pivot(weekly(), new PivotRequest("status", null, null));
    OperationWarning warning = result.warnings().get(result.warnings().size() - 1);
    assertEquals(WarningCode.PIVOT_INDEX_RECONSTRUCTED, warning.code());
    assertEquals("status", warning.column());
  }

  @Test
  void wideOutputWarns() {
    var small = new PivotReshaper(classifier, 2);
    var result = small.pivot(weekly(), new PivotRequest("status", null, null));
    assertEquals(WarningCode.PIVOT_SIZE, result.warnings().get(0).code());
  }

  @Test
  void functionOverrideAppliesPerCell() {
    var result = reshaper.pivot(weekly(),
        new PivotRequest("status", List.of("sales"), Map.of("sales", "count")));
    assertEquals(1L, result.data().get(0, "sales_Done"));
  }

  @Test
  void identifierCellsCountDistinctEvenWhenCountRequested() {
    Table table = TestTables.table(
        row("week", "W1", "status", "Done", "customer_id", "c1"),
        row("week", "W1", "status", "Done", "customer_id", "c1"),
        row("week", "W1", "status", "Open", "customer_id", "c2"));

    var result = reshaper.pivot(table,
        new PivotRequest("status", List.of("customer_id"), Map.of("customer_id", "count")));

    assertEquals(List.of("status", "week", "unique_customers_Done", "unique_customers_Open"),
        result.data().columns());
    assertEquals(1L, result.data().get(0, "unique_customers_Done"));
    assertEquals(1L, result.data().get(0, "unique_customers_Open"));
    assertEquals(WarningCode.IDENTIFIER_OVERRIDE_REJECTED, result.warnings().get(0).code());
    assertEquals("customer_id", result.warnings().get(0).column());
  }

  @Test
  void manyDistinctIndexValuesReconstructQuickly() {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < 2000; i++) {
      rows.add(row("week", "W" + (i % 100), "sku", "S" + i, "sales", 0));
    }
    Table table = Table.of(rows);

    var result = assertTimeout(Duration.ofSeconds(5),
        () -> reshaper.pivot(table, new PivotRequest("sku", List.of("sales"), null)));

    assertEquals(100, result.rowsAfter());
    assertEquals(2002, result.data().columns().size());
    for (var out : result.data().rows()) {
      // every cell is zero, so each row falls back to its group's first sku
      String week = (String) out.get("week");
      assertEquals("S" + week.substring(1), out.get("sku"));
    }
  }

  @Test
  void unknownIndexIsRejected() {
    var ex = assertThrows(InvalidInputException.class,
        () -> reshaper.pivot(weekly(), new PivotRequest("state", null, null)));
    assertEquals("unknown-column", ex.errorCode());
  }
}
