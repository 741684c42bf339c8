package ca.gc.cra.sift.infrastructure.load;

import ca.gc.cra.sift.application.port.RecordLoadException;
import ca.gc.cra.sift.application.port.RecordLoader;
import ca.gc.cra.sift.domain.record.InputFormat;
import ca.gc.cra.sift.domain.record.RawRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link RecordLoader} that reads a local file according to its declared format.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Line formats: UTF-8 with undecodable bytes dropped; blank lines skipped.</li>
 *   <li>JSON: delegated to {@link JsonRecordReader}.</li>
 *   <li>Spreadsheets: delegated to {@link SpreadsheetRecordReader}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class FileRecordLoader implements RecordLoader {
  private final JsonRecordReader jsonReader;
  private final SpreadsheetRecordReader spreadsheetReader;

  public FileRecordLoader() {
    this(new JsonRecordReader(), new SpreadsheetRecordReader());
  }

  FileRecordLoader(JsonRecordReader jsonReader, SpreadsheetRecordReader spreadsheetReader) {
    this.jsonReader = Objects.requireNonNull(jsonReader, "jsonReader");
    this.spreadsheetReader = Objects.requireNonNull(spreadsheetReader, "spreadsheetReader");
  }

  @Override
  public List<RawRecord> load(Path source, InputFormat format) throws RecordLoadException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(format, "format");
    try {
      return switch (format) {
        case LINES, DELIMITED -> readLines(source);
        case JSON -> jsonReader.read(source);
        case SPREADSHEET -> spreadsheetReader.read(source);
      };
    } catch (IOException | RuntimeException ex) {
      throw new RecordLoadException(source, ex);
    }
  }

  /**
   * Reads non-blank lines, ignoring bytes that are not valid UTF-8.
   *
   * @param source file to read
   * @return one record per non-blank line, line terminators removed
   * @throws IOException if the file cannot be read
   */
  static List<RawRecord> readLines(Path source) throws IOException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    List<RawRecord> records = new ArrayList<>();
    try (InputStream in = Files.newInputStream(source);
         BufferedReader reader = new BufferedReader(new InputStreamReader(in, decoder))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) {
          records.add(new RawRecord(line));
        }
      }
    }
    return List.copyOf(records);
  }
}
