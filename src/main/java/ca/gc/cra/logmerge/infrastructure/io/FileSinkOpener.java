package ca.gc.cra.logmerge.infrastructure.io;

import ca.gc.cra.logmerge.application.port.RecordSink;
import ca.gc.cra.logmerge.application.port.SinkOpener;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPOutputStream;

/**
 * Creates (or truncates) the destination file, optionally gzip-compressing it.
 *
 * <p>The gzip stream is created with sync flush, so every record flushed by a merger is readable
 * from the file before the run ends; the gzip trailer is written on close.</p>
 *
 * @since 0.1.0
 */
public final class FileSinkOpener implements SinkOpener {
  private static final int BUFFER_BYTES = 64 * 1024;

  private final boolean gzip;

  /**
   * @param gzip whether to gzip the destination
   */
  public FileSinkOpener(boolean gzip) {
    this.gzip = gzip;
  }

  @Override
  public RecordSink open(String location) throws IOException {
    Path path = Path.of(location);
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    OutputStream out = Files.newOutputStream(
        path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    if (gzip) {
      try {
        out = new GZIPOutputStream(out, BUFFER_BYTES, true);
      } catch (IOException ex) {
        try {
          out.close();
        } catch (IOException closeEx) {
          ex.addSuppressed(closeEx);
        }
        throw ex;
      }
    }
    return new StreamRecordSink(location, new BufferedOutputStream(out, BUFFER_BYTES));
  }
}
