package ca.gc.cra.sift.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for record text that reaches diagnostics.
 * <p><strong>Why:</strong> Source records can be arbitrarily long log lines or spreadsheet rows; warnings quote
 * them only up to a fixed budget.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default character budget for record text in log lines. */
  public static final int DEFAULT_MAX_CHARS = 256;
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates text to {@link #DEFAULT_MAX_CHARS} characters.
   *
   * @param value text to truncate; {@code null} results in {@code "<null>"}
   * @return the original value or a shortened copy with a length suffix
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_CHARS);
  }

  /**
   * Truncates text to {@code maxChars} characters, appending the original length.
   * <p>Never splits a surrogate pair.</p>
   *
   * @param value text to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return the original value when short enough, otherwise the prefix followed by
   *     {@code "... (truncated, N of M chars)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + " chars)";
  }
}
