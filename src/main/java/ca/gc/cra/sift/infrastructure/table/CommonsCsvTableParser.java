package ca.gc.cra.sift.infrastructure.table;

import ca.gc.cra.sift.application.port.TableParser;
import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.table.Delimiter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * {@link TableParser} backed by Apache Commons CSV.
 * <p>Single-character delimiters honour double-quote encapsulation, so a quoted field may contain the
 * delimiter. Whitespace-run splitting ignores quoting. Empty lines are skipped in both modes.</p>
 * <p>Thread-safe; formats are built per call.</p>
 *
 * @since 0.1.0
 */
public final class CommonsCsvTableParser implements TableParser {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  @Override
  public List<List<String>> parse(List<RawRecord> records, Delimiter delimiter) throws TableParseException {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(delimiter, "delimiter");
    if (delimiter instanceof Delimiter.Single single) {
      return parseDelimited(records, single.character());
    }
    return splitWhitespace(records);
  }

  private static List<List<String>> parseDelimited(List<RawRecord> records, char delimiter)
      throws TableParseException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setDelimiter(delimiter)
        .setIgnoreEmptyLines(true)
        .build();
    String document = records.stream().map(RawRecord::text).collect(Collectors.joining("\n"));
    List<List<String>> rows = new ArrayList<>(records.size());
    try (CSVParser parser = CSVParser.parse(document, format)) {
      for (CSVRecord record : parser) {
        List<String> row = new ArrayList<>(record.size());
        record.forEach(row::add);
        rows.add(row);
      }
    } catch (IOException | UncheckedIOException | IllegalStateException ex) {
      throw new TableParseException("malformed delimited data: " + rootMessage(ex), ex);
    }
    return rows;
  }

  private static List<List<String>> splitWhitespace(List<RawRecord> records) {
    List<List<String>> rows = new ArrayList<>(records.size());
    for (RawRecord record : records) {
      String trimmed = record.text().trim();
      if (!trimmed.isEmpty()) {
        rows.add(Arrays.asList(WHITESPACE.split(trimmed)));
      }
    }
    return rows;
  }

  private static String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return String.valueOf(current.getMessage());
  }
}
