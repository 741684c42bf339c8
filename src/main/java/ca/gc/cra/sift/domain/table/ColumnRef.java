package ca.gc.cra.sift.domain.table;

import java.util.Locale;
import java.util.Objects;

/**
 * Reference to one column of a {@link TabularView}.
 *
 * @param index zero-based column position
 * @param name column name as it appears in the header
 * @since 0.1.0
 */
public record ColumnRef(int index, String name) {

  /**
   * Validates the reference.
   *
   * @throws IllegalArgumentException if {@code index} is negative
   */
  public ColumnRef {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    Objects.requireNonNull(name, "name");
  }

  /**
   * Returns the column name lower-cased for case-insensitive comparisons.
   *
   * @return normalized name
   */
  public String normalizedName() {
    return name.toLowerCase(Locale.ROOT);
  }
}
