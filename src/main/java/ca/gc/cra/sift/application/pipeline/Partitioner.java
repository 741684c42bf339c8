package ca.gc.cra.sift.application.pipeline;

import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits loaded records into one partition per worker rank using round-robin assignment: record
 * {@code i} goes to rank {@code i mod W}.
 * <p>Deterministic for a given load order and worker count. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Partitioner {
  private final int workerCount;

  /**
   * Creates a partitioner for a fixed number of ranks.
   *
   * @param workerCount number of ranks; must be positive
   */
  public Partitioner(int workerCount) {
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive (was " + workerCount + ")");
    }
    this.workerCount = workerCount;
  }

  public int workerCount() {
    return workerCount;
  }

  /**
   * Partitions {@code records}.
   *
   * @param records records in load order
   * @return exactly {@link #workerCount()} partitions, indexed by rank; some may be empty
   */
  public List<Partition> partition(List<RawRecord> records) {
    Objects.requireNonNull(records, "records");
    List<List<RawRecord>> buckets = new ArrayList<>(workerCount);
    for (int rank = 0; rank < workerCount; rank++) {
      buckets.add(new ArrayList<>(records.size() / workerCount + 1));
    }
    for (int i = 0; i < records.size(); i++) {
      buckets.get(i % workerCount).add(records.get(i));
    }
    Optional<RawRecord> headerHint = records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    List<Partition> partitions = new ArrayList<>(workerCount);
    for (int rank = 0; rank < workerCount; rank++) {
      partitions.add(new Partition(rank, workerCount, buckets.get(rank), headerHint));
    }
    return List.copyOf(partitions);
  }
}
