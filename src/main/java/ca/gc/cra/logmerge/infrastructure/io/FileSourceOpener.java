package ca.gc.cra.logmerge.infrastructure.io;

import ca.gc.cra.logmerge.application.port.RecordSource;
import ca.gc.cra.logmerge.application.port.SourceOpener;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Opens source files as {@link LineRecordSource}s, optionally gunzipping them.
 * Labels are the file names.
 *
 * @since 0.1.0
 */
public final class FileSourceOpener implements SourceOpener {
  private static final int GZIP_BUFFER_BYTES = 64 * 1024;

  private final boolean gzip;
  private final int maxRecordBytes;

  /**
   * @param gzip whether every source is gzip-compressed
   * @param maxRecordBytes longest accepted line
   */
  public FileSourceOpener(boolean gzip, int maxRecordBytes) {
    if (maxRecordBytes <= 0) {
      throw new IllegalArgumentException("maxRecordBytes must be positive");
    }
    this.gzip = gzip;
    this.maxRecordBytes = maxRecordBytes;
  }

  @Override
  public RecordSource open(String location) throws IOException {
    Path path = Path.of(location);
    InputStream in = Files.newInputStream(path);
    if (gzip) {
      try {
        in = new GZIPInputStream(in, GZIP_BUFFER_BYTES);
      } catch (IOException ex) {
        try {
          in.close();
        } catch (IOException closeEx) {
          ex.addSuppressed(closeEx);
        }
        throw ex;
      }
    }
    Path name = path.getFileName();
    return new LineRecordSource(name == null ? location : name.toString(), in, maxRecordBytes);
  }
}
