package ca.gc.cra.logmerge.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes user-facing merge output (usage text, dry-run plans, run summaries) to standard output.
 *
 * <p>Diagnostics go through SLF4J instead, so redirecting stdout captures only what a user asked
 * for. Output is UTF-8 regardless of the platform encoding, since source labels are file names.</p>
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line of merge output.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a block such as the usage text or a dry-run plan, flushing once at the end.
   *
   * @param lines lines to emit in order
   */
  public static void printLines(String... lines) {
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Captures merge output in tests.
   *
   * @param writer writer receiving output until {@link #clearTestWriter()}
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
