package ca.gc.cra.sift.api;

import ca.gc.cra.sift.application.pipeline.AnalyzeUseCase;
import ca.gc.cra.sift.application.pipeline.WorkerFailureException;
import ca.gc.cra.sift.application.port.RecordLoadException;
import ca.gc.cra.sift.config.AnalyzeConfig;
import ca.gc.cra.sift.config.CompositionRoot;
import ca.gc.cra.sift.config.ConfigMerger;
import ca.gc.cra.sift.config.DefaultsForMode;
import ca.gc.cra.sift.config.YamlConfigLoader;
import ca.gc.cra.sift.domain.record.InputFormat;
import ca.gc.cra.sift.domain.record.UnsupportedFormatException;
import ca.gc.cra.sift.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sift.logging.LoggingConfigurator;
import ca.gc.cra.sift.validation.Paths;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for analyzing one source file for suspicious source addresses.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  static final String MODE = "analyze";
  private static final String SUMMARY_USAGE =
      "usage: analyze in=PATH [out=PATH] [workers=N] [config=PATH] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      SIFT analyze pipeline

      Usage:
        analyze in=./auth.log [options]

      Required:
        in=PATH                  Source file (.log, .txt, .csv, .json, .xlsx, .xls)

      Optional (validated):
        out=PATH                 Result artifact (default ~/.sift/out/results/analysis_result.json)
        workers=N                Worker ranks including the root, 1-256 (default 4)
        config=PATH              YAML file with common/analyze sections; CLI values win
        --dry-run                Validate inputs and print the plan without scanning
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Notes:
        The format is chosen from the file extension.
        The artifact maps each suspicious address to its count, or holds a single "message" entry.
      """;

  private AnalyzeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the analyze CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for analyze CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      try {
        yamlConfig = Optional.of(YamlConfigLoader.load(yamlPath, MODE));
      } catch (NoSuchFileException ex) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    AnalyzeConfig config;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
      if (input.hasFlag("--dry-run")) {
        effective.put("dryRun", "true");
      }
      TelemetryConfigurator.configureMetrics(effective);
      config = AnalyzeConfig.fromMap(effective);
      Paths.validateReadableFile(config.input());
      Paths.validateWritableFile(config.output());
      InputFormat.fromPath(config.input());
    } catch (UnsupportedFormatException ex) {
      log.error("Unsupported input format: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      AnalyzeUseCase useCase = new CompositionRoot(metrics).analyzeUseCase(config);
      log.info("Configured analyze pipeline: input={}, output={}, workers={}, metricsExporter={}",
          config.input(), config.output(), config.workers(), metrics.isNoop() ? "none" : "otlp");
      AnalyzeUseCase.Outcome outcome = useCase.run();
      CliPrinter.println("Analysis complete. " + outcome.result().distinctIps()
          + " suspicious IPs found; results saved at: " + outcome.artifact());
      return ExitCode.SUCCESS;
    } catch (RecordLoadException ex) {
      log.error("Unable to load {}: {}", config.input(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Unable to write result artifact {}", config.output(), ex);
      return ExitCode.IO_ERROR;
    } catch (WorkerFailureException ex) {
      log.error("Analyze pipeline aborted by worker rank {}", ex.rank(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Analyze pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Analyze configuration error: {}", ex.getMessage(), ex);
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analyze pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(AnalyzeConfig config) {
    Map<String, Object> rows = new LinkedHashMap<>();
    rows.put("Input file", config.input());
    rows.put("Declared format", InputFormat.fromPath(config.input()));
    rows.put("Worker ranks", config.workers());
    rows.put("Result artifact", config.output());
    CliPrinter.printTable("Analyze dry-run: no records will be scanned.", rows);
    CliPrinter.println(" Re-run without --dry-run to analyze the input.");
  }
}
