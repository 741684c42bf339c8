package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.domain.table.ColumnRef;
import ca.gc.cra.sift.domain.table.InferredColumns;
import ca.gc.cra.sift.domain.table.TabularView;
import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the source-address column and the attack/label column of an unlabeled table.
 * <p>Name tokens are tried first; content sampling is the fallback. Content sampling counts address
 * matches, not cells, so a cell holding two addresses counts twice. Name matching is a case-insensitive
 * substring test, so {@code resource} matches {@code source} and {@code location} matches {@code cat}.</p>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ColumnInferencer {
  static final List<String> SOURCE_TOKENS = List.of("src", "source", "sip", "src_ip", "source_ip");
  static final List<String> ATTACK_TOKENS = List.of("attack", "label", "cat", "class");
  static final int SOURCE_SAMPLE = 200;
  static final int ATTACK_SAMPLE = 500;
  static final int TRAILING_COLUMNS = 6;

  /**
   * Infers both columns once for a view.
   *
   * @param view parsed view
   * @return inferred columns
   */
  public InferredColumns infer(TabularView view) {
    return new InferredColumns(inferSourceColumn(view), inferAttackColumn(view));
  }

  /**
   * Picks the column most likely to hold source addresses.
   *
   * @param view parsed view
   * @return the chosen column; empty only when the view has no columns
   */
  public Optional<ColumnRef> inferSourceColumn(TabularView view) {
    Objects.requireNonNull(view, "view");
    if (view.columnCount() == 0) {
      return Optional.empty();
    }
    Optional<ColumnRef> byName = firstNamed(view, SOURCE_TOKENS);
    if (byName.isPresent()) {
      return byName;
    }
    for (ColumnRef column : view.columns()) {
      List<String> sample = view.sample(column, SOURCE_SAMPLE);
      long matches = sample.stream().mapToLong(value -> TextPatterns.findIpv4(value).size()).sum();
      int threshold = Math.max(1, Math.min(10, sample.size() / 10));
      if (matches >= threshold) {
        return Optional.of(column);
      }
    }
    return Optional.of(view.column(0));
  }

  /**
   * Picks the column most likely to carry an attack category or label.
   *
   * @param view parsed view
   * @return the chosen column, or empty when no column qualifies
   */
  public Optional<ColumnRef> inferAttackColumn(TabularView view) {
    Objects.requireNonNull(view, "view");
    Optional<ColumnRef> byName = firstNamed(view, ATTACK_TOKENS);
    if (byName.isPresent()) {
      return byName;
    }
    List<ColumnRef> trailing = view.trailingColumns(TRAILING_COLUMNS);
    for (int i = trailing.size() - 1; i >= 0; i--) {
      ColumnRef column = trailing.get(i);
      if (hasTextWithin(view, column, ATTACK_SAMPLE)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  private static boolean hasTextWithin(TabularView view, ColumnRef column, int limit) {
    int rows = Math.min(limit, view.rowCount());
    for (int row = 0; row < rows; row++) {
      if (!view.isNumeric(row, column)) {
        return true;
      }
    }
    return false;
  }

  private static Optional<ColumnRef> firstNamed(TabularView view, List<String> tokens) {
    for (ColumnRef column : view.columns()) {
      String name = column.normalizedName();
      for (String token : tokens) {
        if (name.contains(token)) {
          return Optional.of(column);
        }
      }
    }
    return Optional.empty();
  }
}
