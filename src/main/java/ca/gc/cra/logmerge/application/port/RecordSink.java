package ca.gc.cra.logmerge.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port receiving merged records.
 * <p><strong>Why:</strong> Lets the merge engine emit records without knowing about files or compression.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code StreamRecordSink}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; only the ordered merger or the single writer loop writes.</p>
 * <p><strong>Observability:</strong> The engine flushes after every record so tailing consumers see a valid prefix.</p>
 *
 * @since 0.1.0
 */
public interface RecordSink extends AutoCloseable {
  /**
   * Writes one record followed by the record terminator.
   *
   * @param record record bytes without terminator; must not be {@code null}
   * @throws IOException if the destination rejects the write
   */
  void write(byte[] record) throws IOException;

  /**
   * Pushes buffered bytes to the destination.
   *
   * @throws IOException if the destination cannot be flushed
   */
  void flush() throws IOException;

  @Override
  void close() throws IOException;
}
