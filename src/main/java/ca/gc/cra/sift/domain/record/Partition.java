package ca.gc.cra.sift.domain.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered subset of the loaded records owned by exactly one worker rank.
 * <p><strong>Role:</strong> Created by the root rank immediately before distribution and handed to a
 * single worker; discarded once the worker reports back.</p>
 * <p>The header hint is the first record of the whole source. It is shared read-only so that every
 * rank interprets tabular content against the same header row; it is not part of the records this
 * partition owns.</p>
 *
 * @param rank zero-based worker rank owning this partition
 * @param workerCount total number of ranks in the scan
 * @param records owned records in load order
 * @param headerHint first record of the source, empty when the source produced no records
 * @since 0.1.0
 */
public record Partition(int rank, int workerCount, List<RawRecord> records, Optional<RawRecord> headerHint) {

  /**
   * Validates the partition and takes an immutable copy of the records.
   *
   * @throws IllegalArgumentException if {@code rank} is outside {@code [0, workerCount)}
   */
  public Partition {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive");
    }
    if (rank < 0 || rank >= workerCount) {
      throw new IllegalArgumentException("rank " + rank + " outside [0, " + workerCount + ")");
    }
    records = List.copyOf(Objects.requireNonNull(records, "records"));
    headerHint = Objects.requireNonNull(headerHint, "headerHint");
  }

  /**
   * Indicates whether this partition is owned by the root rank.
   *
   * @return {@code true} for rank 0
   */
  public boolean isRoot() {
    return rank == 0;
  }

  /**
   * Returns the number of owned records.
   *
   * @return owned record count
   */
  public int size() {
    return records.size();
  }

  /**
   * Returns the records a tabular interpretation should see: the header hint followed by the owned
   * records. The root rank already starts with the header, so its records are returned unchanged.
   *
   * @return records with the shared header row first
   */
  public List<RawRecord> withHeader() {
    if (isRoot() || headerHint.isEmpty() || records.isEmpty()) {
      return records;
    }
    List<RawRecord> combined = new ArrayList<>(records.size() + 1);
    combined.add(headerHint.get());
    combined.addAll(records);
    return List.copyOf(combined);
  }
}
