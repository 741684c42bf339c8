package ca.gc.cra.sift.domain.table;

/**
 * Field separator chosen for a tabular partition: either a single character or runs of whitespace.
 *
 * @since 0.1.0
 */
public sealed interface Delimiter permits Delimiter.Single, Delimiter.Whitespace {

  /** Comma separator. */
  Delimiter COMMA = new Single(',');
  /** Tab separator. */
  Delimiter TAB = new Single('\t');
  /** Semicolon separator. */
  Delimiter SEMICOLON = new Single(';');
  /** One or more whitespace characters. */
  Delimiter WHITESPACE = new Whitespace();

  /**
   * Human-readable label for diagnostics.
   *
   * @return label such as {@code ','} or {@code \s+}
   */
  String describe();

  /**
   * Single-character separator.
   *
   * @param character separator character
   */
  record Single(char character) implements Delimiter {
    @Override
    public String describe() {
      return character == '\t' ? "'\\t'" : "'" + character + "'";
    }
  }

  /** Whitespace-run separator. */
  record Whitespace() implements Delimiter {
    @Override
    public String describe() {
      return "\\s+";
    }
  }
}
