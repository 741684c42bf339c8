package ca.gc.cra.sift.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.table.Delimiter;
import ca.gc.cra.sift.domain.table.TabularView;
import ca.gc.cra.sift.infrastructure.table.CommonsCsvTableParser;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FormatSnifferTest {
  private final FormatSniffer sniffer = new FormatSniffer(new CommonsCsvTableParser());

  @Test
  void plainLogLineIsNotTabular() {
    SniffResult result = sniffer.sniff(root(
        "Jan 1 00:00:00 host sshd: Failed password for root from 10.0.0.5 port 22"));

    assertInstanceOf(SniffResult.NotTabular.class, result);
  }

  @Test
  void headerRowNamesColumns() {
    SniffResult result = sniffer.sniff(root("src_ip,label", "9.9.9.9,exploit"));

    SniffResult.Tabular tabular = assertInstanceOf(SniffResult.Tabular.class, result);
    assertEquals(Delimiter.COMMA, tabular.delimiter());
    assertEquals(List.of("src_ip", "label"), tabular.view().header());
    assertEquals(1, tabular.view().rowCount());
  }

  @Test
  void numericFirstRowGetsSyntheticHeader() {
    SniffResult result = sniffer.sniff(root("1,2,3", "4,5,6"));

    TabularView view = assertInstanceOf(SniffResult.Tabular.class, result).view();
    assertEquals(List.of("col0", "col1", "col2"), view.header());
    assertEquals(List.of("4", "5", "6"), firstRow(view));
  }

  @Test
  void blankHeaderCellsArePositional() {
    TabularView view = assertInstanceOf(
        SniffResult.Tabular.class, sniffer.sniff(root("src, ,label", "1.1.1.1,x,dos"))).view();

    assertEquals(List.of("src", "col1", "label"), view.header());
  }

  @Test
  void shortRowsArePadded() {
    TabularView view = assertInstanceOf(
        SniffResult.Tabular.class, sniffer.sniff(root("a,b,c", "1,2"))).view();

    assertEquals(List.of("1", "2", ""), firstRow(view));
  }

  @Test
  void overflowingRowFailsParse() {
    SniffResult result = sniffer.sniff(root("src_ip,label", "1.1.1.1,exploit,extra"));

    SniffResult.ParseFailed failed = assertInstanceOf(SniffResult.ParseFailed.class, result);
    assertTrue(failed.reason().contains("expected 2 fields"));
  }

  @Test
  void unterminatedQuoteFailsParse() {
    SniffResult result = sniffer.sniff(root("src_ip,label", "\"1.1.1.1,exploit"));

    assertInstanceOf(SniffResult.ParseFailed.class, result);
  }

  @Test
  void whitespaceAlignedColumnsSplitOnRuns() {
    SniffResult result = sniffer.sniff(root("src  dst", "1.1.1.1   2.2.2.2"));

    SniffResult.Tabular tabular = assertInstanceOf(SniffResult.Tabular.class, result);
    assertEquals(Delimiter.WHITESPACE, tabular.delimiter());
    assertEquals(List.of("1.1.1.1", "2.2.2.2"), firstRow(tabular.view()));
  }

  @Test
  void nonRootRankParsesWithSharedHeader() {
    Partition partition = new Partition(
        1, 2, List.of(RawRecord.of("9.9.9.9,exploit")), Optional.of(RawRecord.of("src_ip,label")));

    TabularView view = assertInstanceOf(SniffResult.Tabular.class, sniffer.sniff(partition)).view();
    assertEquals(List.of("src_ip", "label"), view.header());
    assertEquals(List.of("9.9.9.9", "exploit"), firstRow(view));
  }

  @Test
  void tabularHeuristicLooksForSeparators() {
    assertTrue(FormatSniffer.looksTabular("a;b"));
    assertTrue(FormatSniffer.looksTabular("a  b"));
    assertFalse(FormatSniffer.looksTabular("a b c"));
  }

  private static List<String> firstRow(TabularView view) {
    return view.columns().stream().map(column -> view.value(0, column)).toList();
  }

  private static Partition root(String... lines) {
    List<RawRecord> records = Arrays.stream(lines).map(RawRecord::of).toList();
    return new Partition(0, 1, records, Optional.of(records.get(0)));
  }
}
