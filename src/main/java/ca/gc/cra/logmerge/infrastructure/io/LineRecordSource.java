package ca.gc.cra.logmerge.infrastructure.io;

import ca.gc.cra.logmerge.application.port.RecordSource;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecordSource} splitting a byte stream into {@code \n}-terminated lines.
 *
 * <p>Terminators are stripped, together with one {@code \r} preceding them. A final line without a
 * terminator is returned; the empty tail after a final {@code \n} is not. A line longer than
 * {@code maxRecordBytes} fails the read with an {@link IOException}.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LineRecordSource implements RecordSource {
  /** Default longest accepted line, in bytes, excluding the terminator. */
  public static final int DEFAULT_MAX_RECORD_BYTES = 64 * 1024;

  private static final int READ_CHUNK = 8192;

  private final String label;
  private final InputStream in;
  private final int maxRecordBytes;
  private LineBuffer buffer;
  private boolean eof;
  private int scanned;

  /**
   * Wraps {@code in}; the source owns the stream from now on.
   *
   * @param label label used in diagnostics
   * @param in stream to split
   * @param maxRecordBytes longest accepted line; must be positive
   */
  public LineRecordSource(String label, InputStream in, int maxRecordBytes) {
    if (maxRecordBytes <= 0) {
      throw new IllegalArgumentException("maxRecordBytes must be positive");
    }
    this.label = Objects.requireNonNull(label, "label");
    this.in = Objects.requireNonNull(in, "in");
    this.maxRecordBytes = maxRecordBytes;
    // room for the line, "\r\n", and one read chunk
    this.buffer = new LineBuffer(maxRecordBytes + 2 + READ_CHUNK);
  }

  @Override
  public String label() {
    return label;
  }

  @Override
  public Optional<byte[]> next() throws IOException {
    LineBuffer buf = buffer;
    if (buf == null) {
      throw new IOException("Source " + label + " is closed");
    }
    while (true) {
      int newline = buf.indexOf((byte) '\n', scanned);
      if (newline >= 0) {
        scanned = 0;
        byte[] line = buf.take(newline);
        buf.skip(1);
        return Optional.of(checked(dropCarriageReturn(line)));
      }
      scanned = buf.readableBytes();
      // max bytes plus a pending '\r' may still turn into a valid record
      if (scanned > maxRecordBytes + 1) {
        throw tooLong();
      }
      if (eof) {
        if (scanned == 0) {
          return Optional.empty();
        }
        scanned = 0;
        return Optional.of(checked(dropCarriageReturn(buf.take(buf.readableBytes()))));
      }
      fill(buf);
    }
  }

  private void fill(LineBuffer buf) throws IOException {
    buf.ensureWritable(Math.min(READ_CHUNK, buf.remainingCapacity()));
    int n = in.read(buf.array(), buf.writerIndex(), buf.writableBytes());
    if (n < 0) {
      eof = true;
    } else {
      buf.advanceWriter(n);
    }
  }

  private byte[] checked(byte[] line) throws IOException {
    if (line.length > maxRecordBytes) {
      throw tooLong();
    }
    return line;
  }

  private IOException tooLong() {
    return new IOException("Record in " + label + " exceeds " + maxRecordBytes + " bytes");
  }

  private static byte[] dropCarriageReturn(byte[] line) {
    if (line.length == 0 || line[line.length - 1] != '\r') {
      return line;
    }
    return Arrays.copyOf(line, line.length - 1);
  }

  @Override
  public void close() throws IOException {
    buffer = null;
    in.close();
  }

  @Override
  public String toString() {
    return "LineRecordSource[" + label + "]";
  }
}
