package ca.gc.cra.logmerge.application.merge;

import java.util.Optional;

/**
 * Base type for failures raised by a merge run.
 *
 * @since 0.1.0
 */
public abstract class MergeException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String sourceLabel;

  protected MergeException(String message, String sourceLabel, Throwable cause) {
    super(message, cause);
    this.sourceLabel = sourceLabel;
  }

  /**
   * Label of the source that caused the failure, when one is involved.
   *
   * @return source label, or empty for job-wide failures
   */
  public Optional<String> sourceLabel() {
    return Optional.ofNullable(sourceLabel);
  }
}
