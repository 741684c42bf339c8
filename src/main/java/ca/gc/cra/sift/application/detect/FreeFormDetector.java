package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.tally.SuspiciousIpTally;
import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Line-wise detection for free-form logs.
 * <p>A record naming a failed password attempt contributes its source address once. Any other record
 * contributes every address-shaped token it contains, once per token.</p>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FreeFormDetector {

  /**
   * Tallies addresses across {@code records}.
   *
   * @param records raw partition records
   * @return local tally
   */
  public SuspiciousIpTally detect(List<RawRecord> records) {
    Objects.requireNonNull(records, "records");
    SuspiciousIpTally.Builder tally = SuspiciousIpTally.builder();
    for (RawRecord record : records) {
      Matcher failed = TextPatterns.FAILED_PASSWORD.matcher(record.text());
      if (failed.find()) {
        tally.increment(failed.group(1));
        continue;
      }
      for (String ip : TextPatterns.findIpv4(record.text())) {
        tally.increment(ip);
      }
    }
    return tally.build();
  }
}
