package ca.gc.cra.sift.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sift.domain.table.InferredColumns;
import ca.gc.cra.sift.domain.table.TabularView;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TabularDetectorTest {
  private final TabularDetector detector = new TabularDetector();

  @Test
  void benignLabelsAreIgnoredCaseInsensitively() {
    TabularView view = TabularView.of(
        List.of("src_ip", "label"),
        List.of(
            List.of("1.1.1.1", "0"),
            List.of("1.1.1.1", "-"),
            List.of("1.1.1.1", "Normal"),
            List.of("1.1.1.1", "BENIGN"),
            List.of("1.1.1.1", "none"),
            List.of("2.2.2.2", "exploit"),
            List.of("2.2.2.2", " DoS ")));

    TabularDetector.Scan scan = detector.scan(view, labelled(view));

    assertEquals(Map.of("2.2.2.2", 2L), scan.hits().asMap());
    assertEquals(Map.of("1.1.1.1", 5L, "2.2.2.2", 2L), scan.sourceFrequencies().asMap());
  }

  @Test
  void missingSourceValuesAreSkipped() {
    TabularView view = TabularView.of(
        List.of("src_ip", "label"),
        List.of(List.of("NaN", "exploit"), List.of("  ", "exploit")));

    assertTrue(detector.scan(view, labelled(view)).hits().isEmpty());
  }

  @Test
  void trailingTextCountsRowWithoutLabel() {
    TabularView view = TabularView.of(
        List.of("src_ip", "a", "b", "c", "d", "e", "f"),
        List.of(
            List.of("4.4.4.4", "1", "2", "3", "4", "5", "6"),
            List.of("5.5.5.5", "1", "2", "3", "4", "5", "tcp")));
    InferredColumns columns = new InferredColumns(Optional.of(view.column(0)), Optional.empty());

    TabularDetector.Scan scan = detector.scan(view, columns);

    assertEquals(Map.of("5.5.5.5", 1L), scan.hits().asMap());
    assertEquals(Map.of("4.4.4.4", 1L, "5.5.5.5", 1L), scan.sourceFrequencies().asMap());
  }

  @Test
  void blankLabelUsesTrailingText() {
    TabularView view = TabularView.of(
        List.of("src_ip", "label"), List.of(List.of("3.3.3.3", "")));

    assertEquals(Map.of("3.3.3.3", 1L), detector.scan(view, labelled(view)).hits().asMap());
  }

  @Test
  void noSourceColumnMeansNoHits() {
    TabularView view = TabularView.of(List.of("label"), List.of(List.of("exploit")));

    TabularDetector.Scan scan = detector.scan(
        view, new InferredColumns(Optional.empty(), Optional.of(view.column(0))));

    assertTrue(scan.hits().isEmpty());
    assertTrue(scan.sourceFrequencies().isEmpty());
  }

  private static InferredColumns labelled(TabularView view) {
    return new InferredColumns(Optional.of(view.column(0)), Optional.of(view.column(1)));
  }
}
