package ca.gc.cra.logmerge.application.port;

import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Port supplying the raw records of one input stream, one at a time.
 * <p><strong>Why:</strong> Keeps the merge engine independent of files, decompression, and line-splitting mechanics.</p>
 * <p><strong>Role:</strong> Input port implemented by adapters such as {@code LineRecordSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return records in the stream's own order, without their terminator.</li>
 *   <li>Signal exhaustion with an empty {@link Optional}.</li>
 *   <li>Release the underlying stream on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a source is driven by exactly one cursor or worker.</p>
 * <p><strong>Performance:</strong> Called once per record; implementations should buffer reads.</p>
 *
 * @since 0.1.0
 */
public interface RecordSource extends AutoCloseable {
  /**
   * Label identifying the source in diagnostics and filter context (typically the file name).
   *
   * @return non-null label
   */
  String label();

  /**
   * Reads the next raw record.
   *
   * <p>Each call returns a freshly allocated array that the caller may keep; concurrent merges
   * queue it for the writer without copying.</p>
   *
   * @return next record bytes; empty once the stream is exhausted
   * @throws IOException if the stream cannot be read or decoded
   */
  Optional<byte[]> next() throws IOException;

  /**
   * Closes the underlying stream.
   *
   * @throws IOException if the stream fails to close
   */
  @Override
  void close() throws IOException;
}
