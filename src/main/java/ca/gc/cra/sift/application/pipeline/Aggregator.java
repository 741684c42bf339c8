package ca.gc.cra.sift.application.pipeline;

import ca.gc.cra.sift.domain.tally.AnalysisResult;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.Collection;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the reports gathered from every rank into one {@link AnalysisResult}.
 * <p>Hit counts are summed per address. When no rank produced a hit, the source-column frequencies of all
 * ranks are summed and only address-shaped values seen more than once are kept, so the frequency
 * fallback sees the whole column regardless of how rows were partitioned. An empty outcome becomes the
 * sentinel result. The merge is commutative and associative.</p>
 *
 * @since 0.1.0
 */
public final class Aggregator {
  private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

  /**
   * Aggregates the gathered reports.
   *
   * @param reports one report per rank, in any order
   * @return findings, or the sentinel when nothing was found
   */
  public AnalysisResult aggregate(Collection<WorkerReport> reports) {
    Objects.requireNonNull(reports, "reports");
    SuspiciousIpTally hits = SuspiciousIpTally.mergeAll(
        reports.stream().map(WorkerReport::hits).toList());
    if (!hits.isEmpty()) {
      return AnalysisResult.of(hits);
    }
    SuspiciousIpTally frequencies = SuspiciousIpTally.mergeAll(
        reports.stream().map(WorkerReport::sourceFrequencies).toList());
    SuspiciousIpTally repeated =
        frequencies.filter((ip, count) -> count > 1 && TextPatterns.startsWithIpv4(ip));
    if (!repeated.isEmpty()) {
      log.info("No row-level hits; reporting {} repeated source addresses", repeated.size());
    }
    return AnalysisResult.of(repeated);
  }
}
