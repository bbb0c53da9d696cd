package ca.gc.cra.logmerge.application.merge;

import java.util.Objects;

/**
 * Raised when a time extractor or record filter returned {@code STOP}.
 * The strategy-supplied cause, if any, is available through {@link #getCause()}.
 *
 * @since 0.1.0
 */
public final class HandlerAbortException extends MergeException {
  private static final long serialVersionUID = 1L;

  private final Stage stage;

  public HandlerAbortException(Stage stage, String sourceLabel, Throwable cause) {
    super(message(stage, sourceLabel, cause), Objects.requireNonNull(sourceLabel, "sourceLabel"), cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  /**
   * Strategy that requested the stop.
   *
   * @return stopping stage
   */
  public Stage stage() {
    return stage;
  }

  private static String message(Stage stage, String sourceLabel, Throwable cause) {
    String base = stage.description() + " stopped source " + sourceLabel;
    return cause == null || cause.getMessage() == null ? base : base + ": " + cause.getMessage();
  }

  /** Strategy kinds that can stop a source. */
  public enum Stage {
    TIME_EXTRACTOR("Time extractor"),
    RECORD_FILTER("Record filter");

    private final String description;

    Stage(String description) {
      this.description = description;
    }

    String description() {
      return description;
    }
  }
}
