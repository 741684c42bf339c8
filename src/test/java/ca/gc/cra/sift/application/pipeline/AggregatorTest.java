package ca.gc.cra.sift.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.sift.domain.tally.AnalysisResult;
import ca.gc.cra.sift.domain.tally.DetectionPath;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AggregatorTest {
  private final Aggregator aggregator = new Aggregator();

  @Test
  void hitsAreSummedAcrossRanks() {
    List<WorkerReport> reports = List.of(
        hits(0, Map.of("1.1.1.1", 1L)),
        hits(1, Map.of("1.1.1.1", 2L, "2.2.2.2", 1L)));

    AnalysisResult result = aggregator.aggregate(reports);

    AnalysisResult.Findings findings = assertInstanceOf(AnalysisResult.Findings.class, result);
    assertEquals(Map.of("1.1.1.1", 3L, "2.2.2.2", 1L), findings.tally().asMap());
  }

  @Test
  void rankOrderDoesNotChangeResult() {
    WorkerReport a = hits(0, Map.of("1.1.1.1", 1L));
    WorkerReport b = hits(1, Map.of("2.2.2.2", 4L, "1.1.1.1", 1L));

    assertEquals(aggregator.aggregate(List.of(a, b)), aggregator.aggregate(List.of(b, a)));
  }

  @Test
  void noReportsYieldsSentinel() {
    AnalysisResult result = aggregator.aggregate(List.of(WorkerReport.empty(0), WorkerReport.empty(1)));

    AnalysisResult.NoFindings none = assertInstanceOf(AnalysisResult.NoFindings.class, result);
    assertEquals(AnalysisResult.NO_FINDINGS_MESSAGE, none.message());
  }

  @Test
  void frequencyFallbackKeepsRepeatedAddressesAcrossRanks() {
    List<WorkerReport> reports = List.of(
        frequencies(0, Map.of("5.5.5.5", 1L, "6.6.6.6", 1L)),
        frequencies(1, Map.of("5.5.5.5", 2L)));

    AnalysisResult result = aggregator.aggregate(reports);

    assertEquals(Map.of("5.5.5.5", 3L),
        assertInstanceOf(AnalysisResult.Findings.class, result).tally().asMap());
  }

  @Test
  void frequencyFallbackIgnoredWhenAnyRankHasHits() {
    List<WorkerReport> reports = List.of(
        frequencies(0, Map.of("5.5.5.5", 4L)),
        hits(1, Map.of("7.7.7.7", 1L)));

    AnalysisResult result = aggregator.aggregate(reports);

    assertEquals(Map.of("7.7.7.7", 1L),
        assertInstanceOf(AnalysisResult.Findings.class, result).tally().asMap());
  }

  @Test
  void singleOccurrencesProduceSentinel() {
    AnalysisResult result = aggregator.aggregate(List.of(frequencies(0, Map.of("6.6.6.6", 1L))));

    assertInstanceOf(AnalysisResult.NoFindings.class, result);
  }

  private static WorkerReport hits(int rank, Map<String, Long> counts) {
    return WorkerReport.freeForm(rank, SuspiciousIpTally.of(counts), DetectionPath.FREE_FORM);
  }

  private static WorkerReport frequencies(int rank, Map<String, Long> counts) {
    return new WorkerReport(
        rank, SuspiciousIpTally.empty(), SuspiciousIpTally.of(counts), DetectionPath.TABULAR);
  }
}
