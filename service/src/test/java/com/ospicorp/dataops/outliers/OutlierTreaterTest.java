package com.ospicorp.dataops.outliers;

import static com.ospicorp.dataops.table.TestTables.row;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.dataops.error.InvalidInputException;
import com.ospicorp.dataops.semantic.ColumnClassifier;
import com.ospicorp.dataops.table.Table;
import com.ospicorp.dataops.table.TestTables;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutlierTreaterTest {
  private final OutlierTreater treater = new OutlierTreater(
      new OutlierDetector(new ColumnClassifier(), List.of(), 1.5, 3.0), 5);

  private static Table values() {
    return TestTables.column("value", 1, 2, 3, 4, 5, 100);
  }

  @Test
  void removeDropsUnionOfFlaggedRows() {
    Table table = TestTables.table(
        row("price", 10, "qty", 1),
        row("price", 11, "qty", 2),
        row("price", 12, "qty", 3),
        row("price", 13, "qty", 4),
        row("price", 14, "qty", 50),
        row("price", 500, "qty", 2));
    var result = treater.treat(table, null, OutlierMethod.IQR, null, TreatmentStrategy.REMOVE,
        null);

    assertEquals(6, result.rowsBefore());
    assertEquals(4, result.rowsAfter());
    assertEquals(2, result.treatedCount());
    assertEquals(List.of(10L, 11L, 12L, 13L), result.data().column("price"));
    assertEquals(2, result.summary().totalOutliers());
  }

  @Test
  void capClampsToDetectedBounds() {
    var result = treater.treat(values(), "value", OutlierMethod.IQR, null, TreatmentStrategy.CAP,
        null);

    assertEquals(6, result.rowsAfter());
    assertEquals(1, result.treatedCount());
    assertEquals(8.5, result.data().get(5, "value"));
    assertEquals(1L, result.data().get(0, "value"));
  }

  @Test
  void winsorizeClampsFlaggedCellsToPercentiles() {
    var result = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.WINSORIZE, null);
    assertEquals(76.25, result.data().get(5, "value"));
    assertEquals(1L, result.data().get(0, "value"));

    var tenth = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.WINSORIZE, "10");
    assertEquals(52.5, tenth.data().get(5, "value"));
  }

  @Test
  void winsorizePercentileMustBeBelowFifty() {
    var ex = assertThrows(InvalidInputException.class, () -> treater.treat(values(), "value",
        OutlierMethod.IQR, null, TreatmentStrategy.WINSORIZE, "60"));
    assertEquals("invalid-strategy-value", ex.errorCode());
  }

  @Test
  void transformUsesLog1pForPositiveColumns() {
    var result = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.TRANSFORM, null);

    assertEquals(0.69, result.data().get(0, "value"));
    assertEquals(4.62, result.data().get(5, "value"));
    assertEquals(1, result.treatedCount());
  }

  @Test
  void transformUsesSignedSqrtWhenNonPositivePresent() {
    Table table = TestTables.column("value", -4, 1, 2, 3, 4, 100);
    var result = treater.treat(table, "value", OutlierMethod.IQR, null,
        TreatmentStrategy.TRANSFORM, null);

    assertEquals(-2.0, result.data().get(0, "value"));
    assertEquals(1.41, result.data().get(2, "value"));
    assertEquals(10.0, result.data().get(5, "value"));
    assertEquals(2, result.treatedCount());
  }

  @Test
  void imputeReplacesWithStatisticOfRemainingValues() {
    var median = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.IMPUTE, null);
    assertEquals(3.0, median.data().get(5, "value"));

    var max = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.IMPUTE, "max");
    assertEquals(5.0, max.data().get(5, "value"));

    var constant = treater.treat(values(), "value", OutlierMethod.IQR, null,
        TreatmentStrategy.IMPUTE, "42");
    assertEquals(42.0, constant.data().get(5, "value"));
    assertEquals("42", constant.summary().strategyValue());
  }

  @Test
  void imputeRejectsUnknownStatistic() {
    var ex = assertThrows(InvalidInputException.class, () -> treater.treat(values(), "value",
        OutlierMethod.IQR, null, TreatmentStrategy.IMPUTE, "bogus"));
    assertEquals("invalid-strategy-value", ex.errorCode());
  }

  @Test
  void replacementFallsBackToZeroWithoutValues() {
    assertEquals(0d, OutlierTreater.replacement(new double[0], "mean"));
    assertEquals(2d, OutlierTreater.replacement(new double[] {2, 2, 7}, "mode"));
  }

  @Test
  void modeTiesGoToEarliestValue() {
    assertEquals(5d, OutlierTreater.replacement(new double[] {5, 7, 7, 5}, "mode"));
    assertEquals(7d, OutlierTreater.replacement(new double[] {5, 7, 7, 5, 7}, "mode"));
  }

  @Test
  void nothingFlaggedLeavesTableUnchanged() {
    Table table = TestTables.column("value", 1, 2, 3);
    var result = treater.treat(table, "value", OutlierMethod.IQR, null, TreatmentStrategy.CAP,
        null);
    assertEquals(0, result.treatedCount());
    assertEquals(List.of(1L, 2L, 3L), result.data().column("value"));
  }

  @Test
  void strategyNamesAcceptAliases() {
    assertEquals(TreatmentStrategy.REMOVE, TreatmentStrategy.fromName(null));
    assertEquals(TreatmentStrategy.CAP, TreatmentStrategy.fromName("clip"));
    assertEquals(TreatmentStrategy.WINSORIZE, TreatmentStrategy.fromName("Winsorise"));
    assertThrows(InvalidInputException.class, () -> TreatmentStrategy.fromName("smooth"));
  }
}
