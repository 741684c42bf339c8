package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.domain.table.Delimiter;
import ca.gc.cra.sift.domain.table.TabularView;
import java.util.Objects;

/**
 * Outcome of {@link FormatSniffer#sniff}: the partition is a table, is free-form text, or looked like a
 * table but could not be parsed as one.
 *
 * @since 0.1.0
 */
public sealed interface SniffResult
    permits SniffResult.Tabular, SniffResult.NotTabular, SniffResult.ParseFailed {

  /**
   * Partition parsed into a view.
   *
   * @param view parsed view
   * @param delimiter delimiter used to split the rows
   */
  record Tabular(TabularView view, Delimiter delimiter) implements SniffResult {
    public Tabular {
      Objects.requireNonNull(view, "view");
      Objects.requireNonNull(delimiter, "delimiter");
    }
  }

  /** Sample shows no delimiter evidence; treat as free-form text. */
  record NotTabular() implements SniffResult {}

  /**
   * Sample looked tabular but parsing the whole partition failed.
   *
   * @param delimiter delimiter that was attempted
   * @param reason failure description for diagnostics
   */
  record ParseFailed(Delimiter delimiter, String reason) implements SniffResult {
    public ParseFailed {
      Objects.requireNonNull(delimiter, "delimiter");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
