package ca.gc.cra.sift.domain.tally;

import java.util.Objects;

/**
 * Outcome of a scan: either a non-empty tally or the "nothing found" sentinel, never both.
 *
 * @since 0.1.0
 */
public sealed interface AnalysisResult permits AnalysisResult.Findings, AnalysisResult.NoFindings {

  /** Message carried by the sentinel result. */
  String NO_FINDINGS_MESSAGE = "No suspicious IPs or attack patterns detected.";

  /**
   * Wraps a merged tally, substituting the sentinel when it is empty.
   *
   * @param tally merged tally
   * @return findings for a non-empty tally, otherwise the sentinel
   */
  static AnalysisResult of(SuspiciousIpTally tally) {
    Objects.requireNonNull(tally, "tally");
    return tally.isEmpty() ? new NoFindings(NO_FINDINGS_MESSAGE) : new Findings(tally);
  }

  /**
   * Number of distinct addresses reported.
   *
   * @return zero for the sentinel
   */
  int distinctIps();

  /**
   * Non-empty tally of suspicious addresses.
   *
   * @param tally merged tally; must not be empty
   */
  record Findings(SuspiciousIpTally tally) implements AnalysisResult {
    public Findings {
      Objects.requireNonNull(tally, "tally");
      if (tally.isEmpty()) {
        throw new IllegalArgumentException("findings require a non-empty tally");
      }
    }

    @Override
    public int distinctIps() {
      return tally.size();
    }
  }

  /**
   * Sentinel meaning no suspicious activity was detected.
   *
   * @param message human-readable note for the presentation layer
   */
  record NoFindings(String message) implements AnalysisResult {
    public NoFindings {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public int distinctIps() {
      return 0;
    }
  }
}
