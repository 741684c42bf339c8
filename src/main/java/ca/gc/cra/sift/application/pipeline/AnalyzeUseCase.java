package ca.gc.cra.sift.application.pipeline;

import ca.gc.cra.sift.application.detect.PartitionScanner;
import ca.gc.cra.sift.application.port.MetricsPort;
import ca.gc.cra.sift.application.port.RecordLoadException;
import ca.gc.cra.sift.application.port.RecordLoader;
import ca.gc.cra.sift.application.port.ResultWriter;
import ca.gc.cra.sift.config.AnalyzeConfig;
import ca.gc.cra.sift.domain.record.InputFormat;
import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.tally.AnalysisResult;
import ca.gc.cra.sift.domain.tally.WorkerReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one analysis of a source file end to end.
 * <p><strong>Role:</strong> Application-layer use case executed by the root rank.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the declared format from the file extension and load the records.</li>
 *   <li>Partition round-robin, scatter to the worker ranks, and gather their reports.</li>
 *   <li>Aggregate the reports and write the result artifact.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once per analysis. Worker ranks only
 * see their own partition and the shared {@link PartitionScanner}.</p>
 * <p><strong>Observability:</strong> Sets the {@code sift.in} MDC key for the duration of the run, increments
 * {@code analyze.records.loaded} and {@code analyze.result.*}, and records {@code analyze.scan.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class AnalyzeUseCase {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeUseCase.class);
  static final String INPUT_MDC_KEY = "sift.in";

  private final AnalyzeConfig config;
  private final RecordLoader loader;
  private final PartitionScanner scanner;
  private final ResultWriter writer;
  private final MetricsPort metrics;
  private final Partitioner partitioner;
  private final ScatterGather scatterGather;
  private final Aggregator aggregator = new Aggregator();

  /**
   * Creates the use case.
   *
   * @param config analyze configuration; must not be {@code null}
   * @param loader source loader; must not be {@code null}
   * @param scanner per-partition detection shared by all ranks; must not be {@code null}
   * @param writer artifact writer; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public AnalyzeUseCase(
      AnalyzeConfig config,
      RecordLoader loader,
      PartitionScanner scanner,
      ResultWriter writer,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.partitioner = new Partitioner(config.workers());
    this.scatterGather = new ScatterGather(config.workers());
  }

  /**
   * Loads, scans, aggregates, and writes.
   *
   * @return outcome describing the result and the artifact written
   * @throws ca.gc.cra.sift.domain.record.UnsupportedFormatException if the input extension is not supported
   * @throws RecordLoadException if the source cannot be read or parsed
   * @throws WorkerFailureException if any worker rank fails; no artifact is written
   * @throws IOException if the artifact cannot be written
   * @throws InterruptedException if the root is interrupted while waiting for the ranks
   */
  public Outcome run() throws IOException, InterruptedException {
    Path input = config.input();
    MDC.put(INPUT_MDC_KEY, input.toString());
    try {
      InputFormat format = InputFormat.fromPath(input);
      List<RawRecord> records = loader.load(input, format);
      metrics.observe("analyze.records.loaded", records.size());
      log.info("Loaded {} records from {} as {}", records.size(), input, format);
      if (records.isEmpty()) {
        log.warn("Input {} contains no records", input);
      }

      long started = System.nanoTime();
      List<Partition> partitions = partitioner.partition(records);
      List<WorkerReport> reports = scatterGather.run(partitions, scanner::scan);
      metrics.observe("analyze.scan.latencyNanos", System.nanoTime() - started);
      for (WorkerReport report : reports) {
        log.info("Rank {} used {} detection and reported {} addresses",
            report.rank(), report.path(), report.hits().size());
      }

      AnalysisResult result = aggregator.aggregate(reports);
      if (result instanceof AnalysisResult.Findings findings) {
        metrics.increment("analyze.result.findings");
        metrics.observe("analyze.ips.detected", findings.distinctIps());
      } else {
        metrics.increment("analyze.result.empty");
      }

      Path artifact = writer.write(result);
      log.info("Wrote {} suspicious addresses to {}", result.distinctIps(), artifact);
      return new Outcome(result, artifact, records.size());
    } catch (WorkerFailureException ex) {
      log.error("Analysis of {} aborted: {}", input, ex.getMessage(), ex);
      throw ex;
    } finally {
      MDC.remove(INPUT_MDC_KEY);
    }
  }

  /**
   * Result of a completed analysis.
   *
   * @param result aggregated findings or the sentinel
   * @param artifact location of the JSON artifact
   * @param recordsLoaded number of records read from the source
   */
  public record Outcome(AnalysisResult result, Path artifact, int recordsLoaded) {
    public Outcome {
      Objects.requireNonNull(result, "result");
      Objects.requireNonNull(artifact, "artifact");
    }
  }
}
