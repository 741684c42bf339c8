package ca.gc.cra.sift.domain.record;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Declared format of an input source, derived from its file extension.
 * <p><strong>Why:</strong> The loader picks its reading strategy from the declared format, not from the content.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum InputFormat {
  /** Line-oriented text such as {@code auth.log}. */
  LINES(List.of(".log", ".txt")),
  /** Delimited text (CSV and friends), read line by line. */
  DELIMITED(List.of(".csv")),
  /** Excel workbook; rows are flattened to tab-joined text. */
  SPREADSHEET(List.of(".xlsx", ".xls")),
  /** JSON document; arrays and objects are expanded into records. */
  JSON(List.of(".json"));

  private final List<String> extensions;

  InputFormat(List<String> extensions) {
    this.extensions = extensions;
  }

  /**
   * Returns the file extensions mapped to this format.
   *
   * @return lower-case extensions including the leading dot
   */
  public List<String> extensions() {
    return extensions;
  }

  /**
   * Resolves the declared format of a path from its extension (case-insensitive).
   *
   * @param path input path; must not be {@code null}
   * @return declared format
   * @throws UnsupportedFormatException when the extension is unknown or missing
   */
  public static InputFormat fromPath(Path path) {
    Objects.requireNonNull(path, "path");
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString();
    int dot = name.lastIndexOf('.');
    String extension = dot < 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    for (InputFormat format : values()) {
      if (format.extensions.contains(extension)) {
        return format;
      }
    }
    throw new UnsupportedFormatException(extension);
  }
}
