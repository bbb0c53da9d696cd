package ca.gc.cra.logmerge.infrastructure.io;

import ca.gc.cra.logmerge.application.port.SourceRemover;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes merged source files. Every file is attempted; the first failure is thrown with later
 * ones attached as suppressed exceptions.
 *
 * @since 0.1.0
 */
public final class FileSourceRemover implements SourceRemover {
  private static final Logger log = LoggerFactory.getLogger(FileSourceRemover.class);

  @Override
  public void remove(List<String> locations) throws IOException {
    IOException failure = null;
    for (String location : locations) {
      try {
        Files.delete(Path.of(location));
        log.debug("Deleted source {}", location);
      } catch (IOException ex) {
        log.warn("Unable to delete source {}", location, ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
