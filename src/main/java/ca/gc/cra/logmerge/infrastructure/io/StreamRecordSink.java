package ca.gc.cra.logmerge.infrastructure.io;

import ca.gc.cra.logmerge.application.port.RecordSink;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link RecordSink} writing each record followed by {@code \n} to an output stream.
 *
 * <p>{@link #flush()} flushes the whole stream chain, so a compressing stream must be created with
 * sync flush for flushed records to reach the file. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class StreamRecordSink implements RecordSink {
  private final String label;
  private final OutputStream out;
  private long recordsWritten;

  /**
   * Wraps {@code out}; the sink owns the stream from now on.
   *
   * @param label destination label for diagnostics
   * @param out stream receiving records
   */
  public StreamRecordSink(String label, OutputStream out) {
    this.label = Objects.requireNonNull(label, "label");
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void write(byte[] record) throws IOException {
    out.write(record);
    out.write('\n');
    recordsWritten++;
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }

  @Override
  public void close() throws IOException {
    out.close();
  }

  /** Records written so far. */
  public long recordsWritten() {
    return recordsWritten;
  }

  @Override
  public String toString() {
    return "StreamRecordSink[" + label + "]";
  }
}
