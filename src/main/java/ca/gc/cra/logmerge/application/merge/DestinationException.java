package ca.gc.cra.logmerge.application.merge;

/**
 * Raised when the destination cannot be created, written, or flushed. Always fatal.
 *
 * @since 0.1.0
 */
public final class DestinationException extends MergeException {
  private static final long serialVersionUID = 1L;

  public DestinationException(String message, Throwable cause) {
    super(message, null, cause);
  }
}
