package ca.gc.cra.sift.application.detect;

import ca.gc.cra.sift.application.port.TableParser;
import ca.gc.cra.sift.application.port.TableParser.TableParseException;
import ca.gc.cra.sift.domain.record.Partition;
import ca.gc.cra.sift.domain.record.RawRecord;
import ca.gc.cra.sift.domain.table.Delimiter;
import ca.gc.cra.sift.domain.table.TabularView;
import ca.gc.cra.sift.domain.util.TextPatterns;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Decides whether a partition is delimited data and, if so, parses it into a
 * {@link TabularView}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify a ten-record sample as tabular when it shows a comma, tab, semicolon, or a whitespace run.</li>
 *   <li>Pick the delimiter via {@link DelimiterSniffer} and parse the whole partition with it.</li>
 *   <li>Treat the first row as the header unless every token is numeric, in which case synthesize names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; one instance may serve all ranks.</p>
 *
 * @since 0.1.0
 */
public final class FormatSniffer {
  static final int SAMPLE_RECORDS = 10;
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s{2,}");

  private final TableParser parser;
  private final DelimiterSniffer delimiterSniffer;

  /**
   * Creates a sniffer using the default delimiter detection.
   *
   * @param parser parser used to split records once a delimiter is chosen
   */
  public FormatSniffer(TableParser parser) {
    this(parser, new DelimiterSniffer());
  }

  FormatSniffer(TableParser parser, DelimiterSniffer delimiterSniffer) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.delimiterSniffer = Objects.requireNonNull(delimiterSniffer, "delimiterSniffer");
  }

  /**
   * Classifies and, when tabular, parses the partition.
   *
   * @param partition partition to inspect; the header hint is included for ranks other than root
   * @return {@link SniffResult.Tabular}, {@link SniffResult.NotTabular}, or {@link SniffResult.ParseFailed}
   */
  public SniffResult sniff(Partition partition) {
    Objects.requireNonNull(partition, "partition");
    List<RawRecord> records = partition.withHeader();
    if (records.isEmpty()) {
      return new SniffResult.NotTabular();
    }
    String sample = sample(records);
    if (!looksTabular(sample)) {
      return new SniffResult.NotTabular();
    }
    Delimiter delimiter = delimiterSniffer.choose(sample);
    List<List<String>> rows;
    try {
      rows = parser.parse(records, delimiter);
    } catch (TableParseException ex) {
      return new SniffResult.ParseFailed(delimiter, ex.getMessage());
    }
    return toView(rows, delimiter);
  }

  /**
   * Indicates whether a sample shows delimiter evidence.
   *
   * @param sample joined sample records
   * @return {@code true} when a comma, tab, semicolon, or run of two or more whitespace characters appears
   */
  static boolean looksTabular(String sample) {
    return sample.indexOf(',') >= 0
        || sample.indexOf('\t') >= 0
        || sample.indexOf(';') >= 0
        || WHITESPACE_RUN.matcher(sample).find();
  }

  static String sample(List<RawRecord> records) {
    return records.stream()
        .limit(SAMPLE_RECORDS)
        .map(RawRecord::text)
        .collect(Collectors.joining("\n"));
  }

  private static SniffResult toView(List<List<String>> rows, Delimiter delimiter) {
    if (rows.isEmpty()) {
      return new SniffResult.ParseFailed(delimiter, "no columns to parse");
    }
    List<String> first = rows.get(0);
    List<String> header = new ArrayList<>(first.size());
    boolean allNumeric = true;
    for (int i = 0; i < first.size(); i++) {
      String token = first.get(i).trim();
      allNumeric &= TextPatterns.isNumeric(token);
      header.add(token.isEmpty() ? "col" + i : token);
    }
    if (allNumeric) {
      header = TabularView.syntheticHeader(first.size());
    }

    int width = header.size();
    List<List<String>> data = new ArrayList<>(rows.size() - 1);
    for (int i = 1; i < rows.size(); i++) {
      List<String> row = rows.get(i);
      if (row.size() > width) {
        return new SniffResult.ParseFailed(
            delimiter, "expected " + width + " fields in row " + i + ", saw " + row.size());
      }
      if (row.size() < width) {
        List<String> padded = new ArrayList<>(row);
        while (padded.size() < width) {
          padded.add("");
        }
        row = padded;
      }
      data.add(row);
    }
    return new SniffResult.Tabular(TabularView.of(header, data), delimiter);
  }
}
