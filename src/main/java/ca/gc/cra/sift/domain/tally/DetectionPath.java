package ca.gc.cra.sift.domain.tally;

/**
 * Detection strategy a worker actually applied to its partition.
 *
 * @since 0.1.0
 */
public enum DetectionPath {
  /** Partition owned no records. */
  EMPTY,
  /** Partition parsed as a table and scanned row by row. */
  TABULAR,
  /** Partition classified as free-form text. */
  FREE_FORM,
  /** Tabular interpretation failed; free-form detector ran instead. */
  TABULAR_FALLBACK
}
