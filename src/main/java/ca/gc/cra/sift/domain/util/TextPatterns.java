package ca.gc.cra.sift.domain.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared text patterns used by detectors and column inference.
 * <p>IPv4 matching is shape-only: four dot-separated groups of one to three digits with no octet range
 * check, so {@code 999.999.1.1} is treated as an address.</p>
 *
 * @since 0.1.0
 */
public final class TextPatterns {
  /** IPv4-shaped token. */
  public static final Pattern IPV4 = Pattern.compile("(?:\\d{1,3}\\.){3}\\d{1,3}");
  /** Optionally signed integer or decimal. */
  public static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");
  /** Failed SSH authentication naming the remote address; group 1 is the address. */
  public static final Pattern FAILED_PASSWORD =
      Pattern.compile("Failed password for.*from (" + IPV4.pattern() + ")");

  private TextPatterns() {
    // Utility
  }

  /**
   * Indicates whether the value begins with an IPv4-shaped token.
   *
   * @param value candidate text; {@code null} yields {@code false}
   * @return {@code true} when the value starts with an address-shaped token
   */
  public static boolean startsWithIpv4(String value) {
    return value != null && IPV4.matcher(value).lookingAt();
  }

  /**
   * Indicates whether the whole value is purely numeric.
   *
   * @param value candidate text; {@code null} yields {@code false}
   * @return {@code true} for values such as {@code 42}, {@code -3} or {@code 0.5}
   */
  public static boolean isNumeric(String value) {
    return value != null && NUMERIC.matcher(value).matches();
  }

  /**
   * Extracts every IPv4-shaped substring in order of appearance.
   *
   * @param value text to scan; {@code null} yields an empty list
   * @return matched tokens, possibly with duplicates
   */
  public static List<String> findIpv4(String value) {
    if (value == null || value.isEmpty()) {
      return List.of();
    }
    List<String> found = new ArrayList<>();
    Matcher matcher = IPV4.matcher(value);
    while (matcher.find()) {
      found.add(matcher.group());
    }
    return found;
  }
}
