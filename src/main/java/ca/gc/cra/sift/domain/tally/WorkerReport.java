package ca.gc.cra.sift.domain.tally;

import java.util.Objects;

/**
 * Value a worker rank submits at the collect point.
 *
 * @param rank reporting rank
 * @param hits addresses counted by the row or line heuristics
 * @param sourceFrequencies frequency of IP-shaped values in the inferred source column; empty unless
 *     the partition was scanned as a table
 * @param path detection strategy applied
 * @since 0.1.0
 */
public record WorkerReport(
    int rank, SuspiciousIpTally hits, SuspiciousIpTally sourceFrequencies, DetectionPath path) {

  public WorkerReport {
    if (rank < 0) {
      throw new IllegalArgumentException("rank must be >= 0");
    }
    Objects.requireNonNull(hits, "hits");
    Objects.requireNonNull(sourceFrequencies, "sourceFrequencies");
    Objects.requireNonNull(path, "path");
  }

  /**
   * Report for a rank that had nothing to scan.
   *
   * @param rank reporting rank
   * @return empty report
   */
  public static WorkerReport empty(int rank) {
    return new WorkerReport(rank, SuspiciousIpTally.empty(), SuspiciousIpTally.empty(), DetectionPath.EMPTY);
  }

  /**
   * Report for a free-form scan (direct or as a fallback).
   *
   * @param rank reporting rank
   * @param hits addresses counted
   * @param path {@link DetectionPath#FREE_FORM} or {@link DetectionPath#TABULAR_FALLBACK}
   * @return report without column frequencies
   */
  public static WorkerReport freeForm(int rank, SuspiciousIpTally hits, DetectionPath path) {
    return new WorkerReport(rank, hits, SuspiciousIpTally.empty(), path);
  }
}
