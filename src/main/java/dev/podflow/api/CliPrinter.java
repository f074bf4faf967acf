package dev.podflow.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for usage text, dry-run plans and run summaries.
 *
 * <p>Summaries are printed as aligned {@code label : value} rows so run, publish and dry-run output line up.
 * Writes go to the stdout file descriptor rather than {@code System.out}.</p>
 */
public final class CliPrinter {
  private static final int LABEL_WIDTH = 17;
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter testWriter;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line as is.
   *
   * @param line text to emit
   */
  public static void println(String line) {
    out().println(line);
  }

  /**
   * Prints one aligned summary row such as {@code " Platforms        : website, twitter"}.
   *
   * @param label row label; longer labels are printed in full
   * @param value row value; {@code null} prints {@code <none>}
   */
  public static void field(String label, Object value) {
    StringBuilder row = new StringBuilder(" ").append(label);
    while (row.length() < LABEL_WIDTH + 1) {
      row.append(' ');
    }
    out().println(row.append(": ").append(value == null ? "<none>" : value));
  }

  static void setWriterForTesting(PrintWriter writer) {
    testWriter = writer;
  }

  static void clearTestWriter() {
    testWriter = null;
  }

  private static PrintWriter out() {
    PrintWriter writer = testWriter;
    return writer != null ? writer : CONSOLE;
  }
}
