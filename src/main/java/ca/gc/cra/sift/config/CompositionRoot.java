package ca.gc.cra.sift.config;

import ca.gc.cra.sift.application.detect.FormatSniffer;
import ca.gc.cra.sift.application.detect.PartitionScanner;
import ca.gc.cra.sift.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.sift.application.port.MetricsPort;
import ca.gc.cra.sift.application.port.RecordLoader;
import ca.gc.cra.sift.application.port.ResultWriter;
import ca.gc.cra.sift.application.port.TableParser;
import ca.gc.cra.sift.infrastructure.load.FileRecordLoader;
import ca.gc.cra.sift.infrastructure.persistence.JsonResultWriter;
import ca.gc.cra.sift.infrastructure.table.CommonsCsvTableParser;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the analyze use case to concrete adapters.
 * <p><strong>Role:</strong> Translates an {@link AnalyzeConfig} into a runnable pipeline: file loader,
 * Commons CSV table parser, JSON result writer, and the supplied metrics port.</p>
 * <p><strong>Thread-safety:</strong> Factory methods create new graphs and are not synchronized; call during
 * startup.</p>
 *
 * @since 0.1.0
 * @see AnalyzeUseCase
 */
public final class CompositionRoot {
  private final MetricsPort metrics;

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metrics metrics port shared by every constructed use case; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the analyze use case for one run.
   *
   * @param config analyze configuration; must not be {@code null}
   * @return wired use case
   */
  public AnalyzeUseCase analyzeUseCase(AnalyzeConfig config) {
    Objects.requireNonNull(config, "config");
    return new AnalyzeUseCase(config, recordLoader(), partitionScanner(), resultWriter(config), metrics);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  RecordLoader recordLoader() {
    return new FileRecordLoader();
  }

  TableParser tableParser() {
    return new CommonsCsvTableParser();
  }

  PartitionScanner partitionScanner() {
    return new PartitionScanner(new FormatSniffer(tableParser()), metrics);
  }

  ResultWriter resultWriter(AnalyzeConfig config) {
    return new JsonResultWriter(config.output());
  }
}
