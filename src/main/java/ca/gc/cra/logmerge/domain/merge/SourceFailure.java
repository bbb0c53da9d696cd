package ca.gc.cra.logmerge.domain.merge;

import java.util.Objects;

/**
 * Per-source failure reported while draining sources concurrently.
 *
 * @param sourceLabel label of the failed source
 * @param cause failure that ended processing of the source
 * @since 0.1.0
 */
public record SourceFailure(String sourceLabel, Exception cause) {
  public SourceFailure {
    Objects.requireNonNull(sourceLabel, "sourceLabel");
    Objects.requireNonNull(cause, "cause");
  }
}
