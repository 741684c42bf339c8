package ca.gc.cra.sift.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output helper for usage text, dry-run plans, and run summaries.
 *
 * <p>Writes to the native stdout descriptor rather than {@code System.out} so CLI output stays separate
 * from the Logback console appender configuration.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    PrintWriter writer = writer();
    writer.println(message);
    writer.flush();
  }

  /**
   * Prints a titled block of aligned {@code label : value} lines.
   *
   * @param title first line of the block
   * @param rows labels mapped to values, printed in iteration order
   */
  public static void printTable(String title, Map<String, ?> rows) {
    int width = 0;
    for (String label : rows.keySet()) {
      width = Math.max(width, label.length());
    }
    PrintWriter writer = writer();
    writer.println(title);
    for (Map.Entry<String, ?> row : rows.entrySet()) {
      writer.println(" " + padRight(row.getKey(), width) + " : " + row.getValue());
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String padRight(String text, int width) {
    StringBuilder padded = new StringBuilder(text);
    while (padded.length() < width) {
      padded.append(' ');
    }
    return padded.toString();
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
