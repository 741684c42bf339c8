package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.domain.table.Delimiter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Infers the field delimiter of a tabular sample.
 * <p>Automatic detection accepts a candidate that appears, outside double quotes, the same non-zero number
 * of times on every sample line. When no candidate is consistent, the fixed priority tab, semicolon,
 * comma, whitespace applies.</p>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class DelimiterSniffer {
  static final int SAMPLE_CHARS = 4096;
  private static final char[] CANDIDATES = {',', '\t', ';', '|'};

  /**
   * Chooses the delimiter for {@code sample}, falling back to presence-based priority.
   *
   * @param sample joined sample records
   * @return chosen delimiter, never {@code null}
   */
  public Delimiter choose(String sample) {
    return detect(sample).orElseGet(() -> fallback(sample));
  }

  /**
   * Attempts consistency-based detection over the first {@value #SAMPLE_CHARS} characters.
   *
   * @param sample joined sample records
   * @return detected delimiter, or empty when detection is inconclusive
   */
  public Optional<Delimiter> detect(String sample) {
    if (sample == null || sample.isEmpty()) {
      return Optional.empty();
    }
    List<String> lines = sampleLines(sample);
    if (lines.isEmpty()) {
      return Optional.empty();
    }
    for (char candidate : CANDIDATES) {
      if (consistent(lines, candidate)) {
        return Optional.of(new Delimiter.Single(candidate));
      }
    }
    return Optional.empty();
  }

  /**
   * Presence-based fallback: tab, then semicolon, then comma, then whitespace runs.
   *
   * @param sample joined sample records
   * @return fallback delimiter
   */
  public Delimiter fallback(String sample) {
    String text = sample == null ? "" : sample;
    if (text.indexOf('\t') >= 0) {
      return Delimiter.TAB;
    }
    if (text.indexOf(';') >= 0) {
      return Delimiter.SEMICOLON;
    }
    if (text.indexOf(',') >= 0) {
      return Delimiter.COMMA;
    }
    return Delimiter.WHITESPACE;
  }

  private static List<String> sampleLines(String sample) {
    boolean truncated = sample.length() > SAMPLE_CHARS;
    String window = truncated ? sample.substring(0, SAMPLE_CHARS) : sample;
    List<String> lines = new ArrayList<>();
    for (String line : window.split("\n", -1)) {
      if (!line.isBlank()) {
        lines.add(line);
      }
    }
    // A line cut at the window edge would skew the per-line counts.
    if (truncated && lines.size() > 1) {
      lines.remove(lines.size() - 1);
    }
    return lines;
  }

  private static boolean consistent(List<String> lines, char candidate) {
    int expected = -1;
    for (String line : lines) {
      int count = countOutsideQuotes(line, candidate);
      if (count == 0) {
        return false;
      }
      if (expected < 0) {
        expected = count;
      } else if (count != expected) {
        return false;
      }
    }
    return expected > 0;
  }

  private static int countOutsideQuotes(String line, char candidate) {
    int count = 0;
    boolean quoted = false;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (c == candidate && !quoted) {
        count++;
      }
    }
    return count;
  }
}
