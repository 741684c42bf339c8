package ca.gc.cra.sift.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a source cannot be read or its structure cannot be decoded.
 * <p>Fatal for the run: the root rank stops before partitioning.</p>
 *
 * @since 0.1.0
 */
public final class RecordLoadException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception for {@code source}.
   *
   * @param source path that failed to load
   * @param cause underlying read or parse failure
   */
  public RecordLoadException(Path source, Throwable cause) {
    super("Error loading file " + source + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
  }
}
