package ca.gc.cra.logmerge.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Path-management collaborator used to delete sources once a merge has fully succeeded.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceRemover {
  /** Remover that leaves every source in place. */
  SourceRemover KEEP = locations -> {};

  /**
   * Removes the given sources.
   *
   * @param locations source locations in job order
   * @throws IOException if a source cannot be removed
   */
  void remove(List<String> locations) throws IOException;
}
