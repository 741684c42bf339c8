package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.domain.table.ColumnRef;
import ca.gc.cra.sift.domain.table.InferredColumns;
import ca.gc.cra.sift.domain.table.TabularView;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Row-wise suspicious-record detection over a {@link TabularView}.
 * <p>A row counts for its source address when its attack value is outside the benign set, or, when no
 * attack value is available, when any of its trailing six values is non-numeric text. The frequency of
 * every address-shaped source value is collected alongside so the aggregator can apply the
 * whole-column frequency fallback.</p>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TabularDetector {
  static final Set<String> BENIGN = Set.of("0", "-", "normal", "benign", "none", "");

  /**
   * Scans every row of {@code view}.
   *
   * @param view parsed partition
   * @param columns columns inferred for {@code view}
   * @return row hits and source-column frequencies
   */
  public Scan scan(TabularView view, InferredColumns columns) {
    Objects.requireNonNull(view, "view");
    Objects.requireNonNull(columns, "columns");
    SuspiciousIpTally.Builder hits = SuspiciousIpTally.builder();
    SuspiciousIpTally.Builder frequencies = SuspiciousIpTally.builder();
    Optional<ColumnRef> source = columns.sourceIpColumn();
    if (source.isEmpty()) {
      return new Scan(hits.build(), frequencies.build());
    }
    ColumnRef sourceColumn = source.get();
    Optional<ColumnRef> attack = columns.attackColumn();
    List<ColumnRef> trailing = view.trailingColumns(ColumnInferencer.TRAILING_COLUMNS);

    for (int row = 0; row < view.rowCount(); row++) {
      String ip = view.value(row, sourceColumn).trim();
      if (ip.isEmpty()) {
        continue;
      }
      if (TextPatterns.startsWithIpv4(ip)) {
        frequencies.increment(ip);
      }
      if (ip.equalsIgnoreCase("nan")) {
        continue;
      }
      String attackValue = attack.isPresent() ? view.value(row, attack.get()).trim() : "";
      if (!attackValue.isEmpty()) {
        if (!BENIGN.contains(attackValue.toLowerCase(Locale.ROOT))) {
          hits.increment(ip);
        }
      } else if (hasTrailingText(view, row, trailing)) {
        hits.increment(ip);
      }
    }
    return new Scan(hits.build(), frequencies.build());
  }

  private static boolean hasTrailingText(TabularView view, int row, List<ColumnRef> trailing) {
    for (ColumnRef column : trailing) {
      if (!view.value(row, column).isBlank() && !view.isNumeric(row, column)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Result of a tabular scan.
   *
   * @param hits addresses counted by the attack-value and trailing-text rules
   * @param sourceFrequencies frequency of address-shaped values in the source column
   */
  public record Scan(SuspiciousIpTally hits, SuspiciousIpTally sourceFrequencies) {
    public Scan {
      Objects.requireNonNull(hits, "hits");
      Objects.requireNonNull(sourceFrequencies, "sourceFrequencies");
    }
  }
}
