package ca.gc.cra.sift.domain.table;

import java.util.Objects;
import java.util.Optional;

/**
 * Columns selected once per {@link TabularView} and passed explicitly to the tabular detector.
 *
 * @param sourceIpColumn column holding source addresses; empty only for a view without columns
 * @param attackColumn column holding an attack or label indicator, when one could be inferred
 * @since 0.1.0
 */
public record InferredColumns(Optional<ColumnRef> sourceIpColumn, Optional<ColumnRef> attackColumn) {

  public InferredColumns {
    Objects.requireNonNull(sourceIpColumn, "sourceIpColumn");
    Objects.requireNonNull(attackColumn, "attackColumn");
  }
}
