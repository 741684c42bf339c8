package ca.gc.cra.sift.application.port;

import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.table.Delimiter;
import java.util.List;

/**
 * Port splitting records into fields with a known delimiter.
 * <p>Rows are returned exactly as split (they may be ragged); alignment to a header is the caller's job.</p>
 *
 * @since 0.1.0
 */
public interface TableParser {
  /**
   * Splits every record into fields.
   *
   * @param records records in partition order
   * @param delimiter delimiter inferred for the partition
   * @return one list of fields per non-empty record
   * @throws TableParseException when the content is structurally malformed (e.g., unbalanced quotes)
   */
  List<List<String>> parse(List<RawRecord> records, Delimiter delimiter) throws TableParseException;

  /**
   * Structural failure raised while splitting records.
   */
  final class TableParseException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message failure description
     * @param cause underlying parser failure, may be {@code null}
     */
    public TableParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
