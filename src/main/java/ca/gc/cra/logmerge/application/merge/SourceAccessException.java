package ca.gc.cra.logmerge.application.merge;

import java.util.Objects;

/**
 * Raised when a source cannot be opened, decompressed, or read.
 *
 * @since 0.1.0
 */
public final class SourceAccessException extends MergeException {
  private static final long serialVersionUID = 1L;

  public SourceAccessException(String sourceLabel, Throwable cause) {
    super("Unable to read source " + sourceLabel + describe(cause),
        Objects.requireNonNull(sourceLabel, "sourceLabel"), cause);
  }

  private static String describe(Throwable cause) {
    return cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
  }
}
