package ca.gc.cra.sift.domain.record;

/**
 * Raised when an input source does not map to any {@link InputFormat}.
 * <p>This is a caller input error: it is surfaced before any partitioning and is never retried.</p>
 *
 * @since 0.1.0
 */
public final class UnsupportedFormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String extension;

  /**
   * Creates the exception for the offending extension.
   *
   * @param extension lower-cased extension including the dot, or an empty string when absent
   */
  public UnsupportedFormatException(String extension) {
    super("Unsupported file type: " + (extension == null || extension.isEmpty() ? "<none>" : extension));
    this.extension = extension == null ? "" : extension;
  }

  /**
   * Returns the rejected extension.
   *
   * @return extension including the leading dot, or empty
   */
  public String extension() {
    return extension;
  }
}
