package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.application.port.MetricsPort;
import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.table.ColumnRef;
import ca.gc.cra.sift.domain.table.InferredColumns;
import ca.gc.cra.sift.domain.table.TabularView;
import ca.gc.cra.sift.domain.tally.DetectionPath;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import ca.gc.cra.sift.logging.Logs;
import java.util.Objects;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Worker-side entry point that turns one partition into a {@link WorkerReport}.
 * <p><strong>Role:</strong> Holds the fallback decision table:
 * <ul>
 *   <li>no records: empty report;</li>
 *   <li>{@link SniffResult.NotTabular}: free-form detection;</li>
 *   <li>{@link SniffResult.ParseFailed}: free-form detection, logged as a fallback;</li>
 *   <li>{@link SniffResult.Tabular}: column inference and tabular detection, with a free-form fallback
 *       when the scan throws.</li>
 * </ul>
 * Fallbacks stay local to the partition and are never retried as tabular.</p>
 * <p><strong>Thread-safety:</strong> Stateless; one instance is shared by every rank.</p>
 * <p><strong>Observability:</strong> Increments {@code analyze.partition.*} counters.</p>
 *
 * @since 0.1.0
 */
public final class PartitionScanner {
  private static final Logger log = LoggerFactory.getLogger(PartitionScanner.class);

  private final FormatSniffer sniffer;
  private final ColumnInferencer inferencer;
  private final BiFunction<TabularView, InferredColumns, TabularDetector.Scan> tabularScan;
  private final FreeFormDetector freeFormDetector;
  private final MetricsPort metrics;

  /**
   * Creates a scanner with the default detectors.
   *
   * @param sniffer format sniffer
   * @param metrics metrics sink
   */
  public PartitionScanner(FormatSniffer sniffer, MetricsPort metrics) {
    this(sniffer, new ColumnInferencer(), new TabularDetector()::scan, new FreeFormDetector(), metrics);
  }

  PartitionScanner(
      FormatSniffer sniffer,
      ColumnInferencer inferencer,
      BiFunction<TabularView, InferredColumns, TabularDetector.Scan> tabularScan,
      FreeFormDetector freeFormDetector,
      MetricsPort metrics) {
    this.sniffer = Objects.requireNonNull(sniffer, "sniffer");
    this.inferencer = Objects.requireNonNull(inferencer, "inferencer");
    this.tabularScan = Objects.requireNonNull(tabularScan, "tabularScan");
    this.freeFormDetector = Objects.requireNonNull(freeFormDetector, "freeFormDetector");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Scans one partition.
   *
   * @param partition partition owned by the calling rank
   * @return the rank's report
   */
  public WorkerReport scan(Partition partition) {
    Objects.requireNonNull(partition, "partition");
    if (partition.records().isEmpty()) {
      log.debug("Rank {} received an empty partition", partition.rank());
      return WorkerReport.empty(partition.rank());
    }

    SniffResult sniff = sniffer.sniff(partition);
    if (sniff instanceof SniffResult.Tabular tabular) {
      try {
        InferredColumns columns = inferencer.infer(tabular.view());
        log.debug("Rank {} parsed {} rows with delimiter {}; source={}, attack={}",
            partition.rank(),
            tabular.view().rowCount(),
            tabular.delimiter().describe(),
            columns.sourceIpColumn().map(ColumnRef::name).orElse("<none>"),
            columns.attackColumn().map(ColumnRef::name).orElse("<none>"));
        TabularDetector.Scan scan = tabularScan.apply(tabular.view(), columns);
        metrics.increment("analyze.partition.tabular");
        return new WorkerReport(
            partition.rank(), scan.hits(), scan.sourceFrequencies(), DetectionPath.TABULAR);
      } catch (RuntimeException ex) {
        log.warn("Rank {} tabular scan failed, falling back to free-form: {}",
            partition.rank(), Logs.truncate(ex.toString()));
        return fallback(partition);
      }
    }
    if (sniff instanceof SniffResult.ParseFailed failed) {
      log.warn("Rank {} tabular parse failed with delimiter {}: {}",
          partition.rank(), failed.delimiter().describe(), Logs.truncate(failed.reason()));
      return fallback(partition);
    }
    metrics.increment("analyze.partition.freeform");
    SuspiciousIpTally hits = freeFormDetector.detect(partition.records());
    return WorkerReport.freeForm(partition.rank(), hits, DetectionPath.FREE_FORM);
  }

  private WorkerReport fallback(Partition partition) {
    metrics.increment("analyze.partition.fallback");
    SuspiciousIpTally hits = freeFormDetector.detect(partition.records());
    return WorkerReport.freeForm(partition.rank(), hits, DetectionPath.TABULAR_FALLBACK);
  }
}
