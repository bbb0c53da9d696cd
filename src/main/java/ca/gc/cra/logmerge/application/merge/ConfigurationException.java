package ca.gc.cra.logmerge.application.merge;

/**
 * Raised when a merge job is misconfigured; no source or destination has been opened yet.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends MergeException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message, null, null);
  }
}
