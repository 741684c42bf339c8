package ca.gc.cra.sift.domain.record;

import java.util.Objects;

/**
 * One unit of loaded input: a text line, a JSON element, or a spreadsheet row flattened to text.
 *
 * @param text record text exactly as produced by the loader; never {@code null}
 * @since 0.1.0
 */
public record RawRecord(String text) {

  /**
   * Validates the record text.
   *
   * @throws NullPointerException if {@code text} is {@code null}
   */
  public RawRecord {
    Objects.requireNonNull(text, "text");
  }

  /**
   * Convenience factory used by loaders and tests.
   *
   * @param text record text
   * @return new record
   */
  public static RawRecord of(String text) {
    return new RawRecord(text);
  }
}
