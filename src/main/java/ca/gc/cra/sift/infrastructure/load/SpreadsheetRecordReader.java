package ca.gc.cra.sift.infrastructure.load;

import ca.gc.cra.sift.domain.record.RawRecord;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

/**
 * Flattens the first sheet of an {@code .xlsx} or {@code .xls} workbook into tab-joined records.
 * <p>The header row is kept so column names reach the sniffer. Cells are rendered as the workbook displays
 * them; gaps inside a row become empty fields. Rows whose cells are all blank are skipped.</p>
 *
 * @since 0.1.0
 */
public final class SpreadsheetRecordReader {
  static final char CELL_SEPARATOR = '\t';

  /**
   * Reads the first sheet of the workbook at {@code source}.
   *
   * @param source workbook file
   * @return one record per non-blank row
   * @throws IOException if the file cannot be read or is not a workbook
   */
  public List<RawRecord> read(Path source) throws IOException {
    Objects.requireNonNull(source, "source");
    DataFormatter formatter = new DataFormatter();
    try (InputStream in = Files.newInputStream(source);
         Workbook workbook = WorkbookFactory.create(in)) {
      if (workbook.getNumberOfSheets() == 0) {
        return List.of();
      }
      Sheet sheet = workbook.getSheetAt(0);
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
      List<RawRecord> records = new ArrayList<>();
      for (Row row : sheet) {
        String line = flatten(row, formatter, evaluator);
        if (line != null) {
          records.add(new RawRecord(line));
        }
      }
      return List.copyOf(records);
    }
  }

  private static String flatten(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
    short last = row.getLastCellNum();
    if (last <= 0) {
      return null;
    }
    StringBuilder line = new StringBuilder();
    boolean blank = true;
    for (int i = 0; i < last; i++) {
      if (i > 0) {
        line.append(CELL_SEPARATOR);
      }
      Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      String text = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
      blank &= text.isBlank();
      line.append(text);
    }
    return blank ? null : line.toString();
  }
}
