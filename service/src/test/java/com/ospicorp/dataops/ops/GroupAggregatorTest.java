package com.ospicorp.dataops.ops;

import static com.ospicorp.dataops.table.TestTables.row;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.error.OperationWarning;
import com.ospicorp.dataops.error.WarningCode;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.TestTables;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GroupAggregatorTest {
  private final GroupAggregator aggregator = new GroupAggregator(new ColumnClassifier());

  private static Table orders() {
    return TestTables.table(
        row("region", "North", "customer_id", "c1", "qty", 2, "price", 10.0),
        row("region", "South", "customer_id", "c2", "qty", 1, "price", 20.0),
        row("region", "North", "customer_id", "c2", "qty", 3, "price", 30.0),
        row("region", "North", "customer_id", "c1", "qty", 1, "price", 5.5));
  }

  @Test
  void defaultsSumMeasuresAndCountDistinctIdentifiers() {
    var result = aggregator.aggregate(orders(), AggregateRequest.groupBy("region", null));

    assertEquals(List.of("region", "unique_customers", "qty (Sum)", "price (Sum)"),
        result.data().columns());
    assertEquals(4, result.rowsBefore());
    assertEquals(2, result.rowsAfter());

    Map<String, Object> north = result.data().rows().get(0);
    assertEquals("North", north.get("region"));
    assertEquals(2L, north.get("unique_customers"));
    assertEquals(6L, north.get("qty (Sum)"));
    assertEquals(45.5, north.get("price (Sum)"));

    Map<String, Object> south = result.data().rows().get(1);
    assertEquals(1L, south.get("unique_customers"));
    assertEquals(1L, south.get("qty (Sum)"));
    assertTrue(result.warnings().isEmpty());
  }

  @Test
  void groupsByBareIdColumnAndSumsQuantity() {
    Table table = TestTables.table(
        row("id", "A", "qty", 10),
        row("id", "A", "qty", 5),
        row("id", "B", "qty", 7));

    var result = aggregator.aggregate(table, AggregateRequest.groupBy("id", List.of("qty")));

    assertEquals(List.of("id", "qty (Sum)"), result.data().columns());
    assertEquals(List.of(
        Map.of("id", "A", "qty (Sum)", 15L),
        Map.of("id", "B", "qty (Sum)", 7L)), result.data().rows());
  }

  @Test
  void numericCustomerIdsAreCountedDistinct() {
    Table table = TestTables.table(
        row("store", "S1", "customer_id", 1),
        row("store", "S1", "customer_id", 1),
        row("store", "S2", "customer_id", 2),
        row("store", "S2", "customer_id", 3));

    var result = aggregator.aggregate(table,
        AggregateRequest.groupBy("store", List.of("customer_id")));

    assertEquals(List.of("store", "unique_customers"), result.data().columns());
    assertEquals(1L, result.data().get(0, "unique_customers"));
    assertEquals(2L, result.data().get(1, "unique_customers"));
  }

  @Test
  void intentSwitchesMeasuresToMeanAndRounds() {
    var request = new AggregateRequest("region", List.of("price"), null, null, null,
        "average price");
    var result = aggregator.aggregate(orders(), request);

    assertEquals(List.of("region", "avg_price"), result.data().columns());
    assertEquals(15.17, result.data().get(0, "avg_price"));
  }

  @Test
  void identifierCannotBeSummed() {
    var request = new AggregateRequest("region", List.of("customer_id"),
        Map.of("customer_id", "sum"), null, null, null);
    var result = aggregator.aggregate(orders(), request);

    assertEquals(2L, result.data().get(0, "unique_customers"));
    assertEquals(WarningCode.IDENTIFIER_OVERRIDE_REJECTED, result.warnings().get(0).code());
  }

  @Test
  void overridesMatchColumnsIgnoringCase() {
    var request = new AggregateRequest("region", List.of("qty"), Map.of("QTY", "max"), null,
        null, null);
    var result = aggregator.aggregate(orders(), request);

    assertEquals(3L, result.data().get(0, "max_qty"));
  }

  @Test
  void sortsByResultOrSourceColumnName() {
    var byQty = new AggregateRequest("region", null, null, "qty", "desc", null);
    var result = aggregator.aggregate(orders(), byQty);
    assertEquals("North", result.data().get(0, "region"));

    var byPrice = new AggregateRequest("region", null, null, "price (Sum)", "asc", null);
    result = aggregator.aggregate(orders(), byPrice);
    assertEquals("South", result.data().get(0, "region"));
  }

  @Test
  void unknownSortColumnWarnsAndKeepsOrder() {
    var request = new AggregateRequest("region", null, null, "bogus", null, null);
    var result = aggregator.aggregate(orders(), request);

    assertEquals("North", result.data().get(0, "region"));
    OperationWarning warning = result.warnings().get(0);
    assertEquals(WarningCode.SORT_COLUMN_NOT_FOUND, warning.code());
    assertEquals("bogus", warning.column());
  }

  @Test
  void rowsWithoutKeyAreSkippedAndEmptyGroupsYieldMissing() {
    Table table = TestTables.table(
        row("region", "A", "qty", null),
        row("region", null, "qty", 5),
        row("region", "B", "qty", 2));
    var result = aggregator.aggregate(table, AggregateRequest.groupBy("region", null));

    assertEquals(3, result.rowsBefore());
    assertEquals(2, result.rowsAfter());
    assertNull(result.data().get(0, "qty (Sum)"));
    assertEquals(2L, result.data().get(1, "qty (Sum)"));
  }

  @Test
  void explicitDateColumnTakesLatestValue() {
    Table table = TestTables.table(
        row("region", "A", "order_date", "2024-01-05"),
        row("region", "A", "order_date", "2024-02-01"));
    var result = aggregator.aggregate(table,
        AggregateRequest.groupBy("region", List.of("order_date")));

    assertEquals(LocalDate.of(2024, 2, 1), result.data().get(0, "max_order_date"));
  }

  @Test
  void textWithoutNumbersIsDroppedWithWarning() {
    Table table = TestTables.table(
        row("region", "A", "notes", "late", "qty", 1),
        row("region", "B", "notes", "ok", "qty", 2));
    var result = aggregator.aggregate(table,
        AggregateRequest.groupBy("region", List.of("notes", "qty")));

    assertEquals(List.of("region", "qty (Sum)"), result.data().columns());
    assertEquals(WarningCode.TEXT_COLUMN_DROPPED, result.warnings().get(0).code());
  }

  @Test
  void unknownGroupColumnListsAvailableColumns() {
    var ex = assertThrows(InvalidInputException.class,
        () -> aggregator.aggregate(orders(), AggregateRequest.groupBy("country", null)));
    assertEquals("unknown-column", ex.errorCode());
    assertTrue(ex.moreInfo().contains("region"));
  }

  @Test
  void nothingToAggregateReportsRoleCounts() {
    Table table = TestTables.table(row("region", "A", "notes", "x"));
    var ex = assertThrows(InvalidInputException.class,
        () -> aggregator.aggregate(table, AggregateRequest.groupBy("region", null)));
    assertEquals("no-value-columns", ex.errorCode());
    assertTrue(ex.moreInfo().contains("text=1"));
  }

  @Test
  void missingGroupColumnIsRejected() {
    var ex = assertThrows(InvalidInputException.class,
        () -> aggregator.aggregate(orders(), AggregateRequest.groupBy(" ", null)));
    assertEquals("missing-group-column", ex.errorCode());
  }

  @Test
  void inputTableIsNotModified() {
    Table table = orders();
    aggregator.aggregate(table, AggregateRequest.groupBy("region", null));
    assertEquals(4, table.rowCount());
    assertEquals(10.0, table.get(0, "price"));
  }

  @Test
  void directionParsing() {
    assertTrue(GroupAggregator.isDescending("DESC"));
    assertTrue(GroupAggregator.isDescending(" descending "));
    assertFalse(GroupAggregator.isDescending("asc"));
    assertFalse(GroupAggregator.isDescending(null));
  }
}
