package ca.gc.cra.sift.api;

/**
 * <strong>What:</strong> Canonical exit codes returned by the SIFT command line.
 * <p><strong>Why:</strong> Lets automation tell argument mistakes, unreadable inputs, and worker failures apart.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or the input format were invalid. */
  INVALID_ARGS(2),
  /** The source or the artifact could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** A worker rank failed or an unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
