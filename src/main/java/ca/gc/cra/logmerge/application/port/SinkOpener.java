package ca.gc.cra.logmerge.application.port;

import java.io.IOException;

/**
 * Output collaborator that creates (and, when configured, compresses) the destination.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SinkOpener {
  /**
   * Creates the destination.
   *
   * @param location destination location as configured
   * @return open sink; the caller owns and closes it
   * @throws IOException if the destination cannot be created
   */
  RecordSink open(String location) throws IOException;
}
