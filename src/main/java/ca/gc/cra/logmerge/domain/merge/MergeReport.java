package ca.gc.cra.logmerge.domain.merge;

import java.util.List;
import java.util.Objects;

/**
 * Summary of a finished merge run.
 *
 * @param mode mode the run used
 * @param recordsWritten records written and flushed to the destination
 * @param recordsSkipped raw records discarded by a strategy returning {@link Action#SKIP}
 * @param failures per-source failures (concurrent mode only; ordered mode fails fast instead)
 * @param cancelled whether the run observed cancellation before draining every source
 * @since 0.1.0
 */
public record MergeReport(
    MergeMode mode,
    long recordsWritten,
    long recordsSkipped,
    List<SourceFailure> failures,
    boolean cancelled) {

  public MergeReport {
    Objects.requireNonNull(mode, "mode");
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  /**
   * Indicates whether every source was drained without failure or cancellation.
   *
   * @return {@code true} for a complete, clean run
   */
  public boolean complete() {
    return !cancelled && failures.isEmpty();
  }
}
