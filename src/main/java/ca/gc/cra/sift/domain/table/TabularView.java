package ca.gc.cra.sift.domain.table;

import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Column-oriented reinterpretation of a partition classified as delimited data.
 * <p><strong>Why:</strong> Gives column inference and tabular detection typed, named access to arbitrary
 * schemas instead of ad hoc field lookups.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold an ordered header and rows aligned to it (every row has exactly one value per column).</li>
 *   <li>Expose cells, a numeric probe per cell, and bounded column samples.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class TabularView {
  private final List<String> header;
  private final List<List<String>> rows;

  private TabularView(List<String> header, List<List<String>> rows) {
    this.header = header;
    this.rows = rows;
  }

  /**
   * Builds a view from a header and aligned rows.
   *
   * @param header column names in order; must not be {@code null}
   * @param rows data rows; each must contain exactly {@code header.size()} values
   * @return immutable view
   * @throws IllegalArgumentException if a row is not aligned to the header
   */
  public static TabularView of(List<String> header, List<List<String>> rows) {
    List<String> names = List.copyOf(Objects.requireNonNull(header, "header"));
    List<List<String>> copy = new ArrayList<>(Objects.requireNonNull(rows, "rows").size());
    for (int i = 0; i < rows.size(); i++) {
      List<String> row = rows.get(i);
      if (row.size() != names.size()) {
        throw new IllegalArgumentException(
            "row " + i + " has " + row.size() + " values but header has " + names.size());
      }
      copy.add(List.copyOf(row));
    }
    return new TabularView(names, List.copyOf(copy));
  }

  /**
   * Synthesizes positional column names {@code col0 .. colN-1}.
   *
   * @param count number of columns
   * @return generated names
   */
  public static List<String> syntheticHeader(int count) {
    List<String> names = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      names.add("col" + i);
    }
    return names;
  }

  public List<String> header() {
    return header;
  }

  public int columnCount() {
    return header.size();
  }

  public int rowCount() {
    return rows.size();
  }

  /**
   * Returns a reference to the column at {@code index}.
   *
   * @param index zero-based column index
   * @return column reference
   * @throws IndexOutOfBoundsException when {@code index} is outside the header
   */
  public ColumnRef column(int index) {
    return new ColumnRef(index, header.get(index));
  }

  /**
   * Returns references to all columns in header order.
   *
   * @return column references
   */
  public List<ColumnRef> columns() {
    List<ColumnRef> refs = new ArrayList<>(header.size());
    for (int i = 0; i < header.size(); i++) {
      refs.add(column(i));
    }
    return refs;
  }

  /**
   * Returns the last {@code count} columns (or all when fewer exist) in header order.
   *
   * @param count maximum number of trailing columns
   * @return trailing column references, leftmost first
   */
  public List<ColumnRef> trailingColumns(int count) {
    List<ColumnRef> all = columns();
    return all.subList(Math.max(0, all.size() - count), all.size());
  }

  /**
   * Returns the raw value of a cell.
   *
   * @param row zero-based row index
   * @param column column reference
   * @return cell text, possibly empty
   */
  public String value(int row, ColumnRef column) {
    return rows.get(row).get(column.index());
  }

  /**
   * Indicates whether a cell is purely numeric once trimmed.
   *
   * @param row zero-based row index
   * @param column column reference
   * @return {@code true} for values such as {@code 80} or {@code -0.25}
   */
  public boolean isNumeric(int row, ColumnRef column) {
    return TextPatterns.isNumeric(value(row, column).trim());
  }

  /**
   * Returns the first {@code limit} values of a column.
   *
   * @param column column reference
   * @param limit maximum number of values to return
   * @return values in row order
   */
  public List<String> sample(ColumnRef column, int limit) {
    int size = Math.min(limit, rows.size());
    List<String> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add(rows.get(i).get(column.index()));
    }
    return values;
  }
}
