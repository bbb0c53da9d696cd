package ca.gc.cra.logmerge.application.port;

import java.io.IOException;

/**
 * Input collaborator that opens (and, when configured, decompresses) a source location.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceOpener {
  /**
   * Opens the named source.
   *
   * @param location source location as configured (e.g., a file path)
   * @return open record source; the caller owns and closes it
   * @throws IOException if the source cannot be opened or its compression header is invalid
   */
  RecordSource open(String location) throws IOException;
}
