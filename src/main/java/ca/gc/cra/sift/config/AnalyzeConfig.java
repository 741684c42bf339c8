package ca.gc.cra.sift.config;

import ca.gc.cra.sift.validation.Numbers;
import ca.gc.cra.sift.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Captures configuration for the analyze pipeline that tallies suspicious source addresses.
 * <p><strong>Why:</strong> Consolidates CLI arguments, YAML sections, and embedded defaults into one validated value
 * so a run is reproducible.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the input file and the result artifact location.</li>
 *   <li>Bound the worker count to {@value #MIN_WORKERS}..{@value #MAX_WORKERS}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input source file to analyze; absolute and normalized
 * @param output JSON artifact location; absolute and normalized
 * @param workers number of worker ranks, root included
 * @param dryRun when {@code true} the CLI validates and prints the plan without scanning
 * @since 0.1.0
 * @see ca.gc.cra.sift.application.pipeline.AnalyzeUseCase
 */
public record AnalyzeConfig(Path input, Path output, int workers, boolean dryRun) {
  public static final int DEFAULT_WORKERS = 4;
  public static final int MIN_WORKERS = 1;
  public static final int MAX_WORKERS = 256;

  /**
   * Normalizes paths and enforces the worker range.
   *
   * @throws IllegalArgumentException if {@code workers} is out of range or a path is invalid
   */
  public AnalyzeConfig {
    input = Objects.requireNonNull(input, "input").toAbsolutePath().normalize();
    output = Objects.requireNonNull(output, "output").toAbsolutePath().normalize();
    Numbers.requireRange("workers", workers, MIN_WORKERS, MAX_WORKERS);
  }

  /**
   * Returns the artifact location used when {@code out} is not supplied.
   *
   * @return {@code ~/.sift/out/results/analysis_result.json}
   */
  public static Path defaultOutput() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".sift", "out", "results", "analysis_result.json");
  }

  /**
   * Creates a configuration instance from CLI-style key/value pairs.
   *
   * @param options key/value pairs such as {@code in}, {@code out}, {@code workers}, {@code dryRun}
   * @return populated configuration
   * @throws IllegalArgumentException when {@code in} is missing or a value is invalid
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String inRaw = options.get("in");
    if (inRaw == null || inRaw.isBlank()) {
      throw new IllegalArgumentException("in is required");
    }
    Path input = Paths.parse("in", inRaw);

    String outRaw = options.get("out");
    Path output = outRaw == null || outRaw.isBlank() ? defaultOutput() : Paths.parse("out", outRaw);

    String workersRaw = options.get("workers");
    int workers = workersRaw == null || workersRaw.isBlank()
        ? DEFAULT_WORKERS
        : Numbers.parseIntInRange("workers", workersRaw, MIN_WORKERS, MAX_WORKERS);

    boolean dryRun = parseBoolean(options.get("dryRun"), false);
    return new AnalyzeConfig(input, output, workers, dryRun);
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
