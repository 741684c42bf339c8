package ca.gc.cra.sift.domain.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TabularViewTest {

  private final TabularView view = TabularView.of(
      List.of("Src_IP", "bytes", "label"),
      List.of(
          List.of("1.1.1.1", "120", "benign"),
          List.of("2.2.2.2", " 7.5 ", "exploit")));

  @Test
  void columnsKeepHeaderOrderAndNormalizeNames() {
    ColumnRef source = view.columns().get(0);

    assertEquals(0, source.index());
    assertEquals("Src_IP", source.name());
    assertEquals("src_ip", source.normalizedName());
    assertEquals("2.2.2.2", view.value(1, source));
  }

  @Test
  void trailingColumnsAreBoundedByWidth() {
    assertEquals(3, view.trailingColumns(6).size());
    assertEquals(List.of(view.column(1), view.column(2)), view.trailingColumns(2));
  }

  @Test
  void numericProbeTrimsCellText() {
    ColumnRef bytes = view.column(1);

    assertTrue(view.isNumeric(0, bytes));
    assertTrue(view.isNumeric(1, bytes));
    assertFalse(view.isNumeric(1, view.column(2)));
  }

  @Test
  void sampleStopsAtLimit() {
    assertEquals(List.of("1.1.1.1"), view.sample(view.column(0), 1));
    assertEquals(List.of("benign", "exploit"), view.sample(view.column(2), 10));
  }

  @Test
  void raggedRowsAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TabularView.of(List.of("a", "b"), List.of(List.of("only"))));
  }

  @Test
  void syntheticHeaderNamesByPosition() {
    assertEquals(List.of("col0", "col1", "col2"), TabularView.syntheticHeader(3));
  }
}
