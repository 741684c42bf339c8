package ca.gc.cra.sift.application.port;

import ca.gc.cra.sift.domain.record.InputFormat;
import ca.gc.cra.sift.domain.record.RawRecord;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port that reads a data source into an ordered sequence of {@link RawRecord}s.
 * <p><strong>Role:</strong> Invoked only by the root rank, before partitioning.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and have no side effects beyond the read.</p>
 *
 * @since 0.1.0
 */
public interface RecordLoader {
  /**
   * Loads every record of {@code source} interpreted as {@code format}.
   *
   * @param source readable file; must not be {@code null}
   * @param format declared format of the source; must not be {@code null}
   * @return records in source order; never {@code null}
   * @throws RecordLoadException when the source cannot be read or decoded
   */
  List<RawRecord> load(Path source, InputFormat format) throws RecordLoadException;
}
