package ca.gc.cra.logmerge.domain.merge;

/**
 * Outcome of a single time-extraction or filter invocation.
 *
 * @since 0.1.0
 */
public enum Action {
  /** Use the record as returned by the strategy. */
  ACCEPT,
  /** Drop the record and continue with the next raw record of the same source. */
  SKIP,
  /** Abort the source (ordered mode: the whole merge) with the strategy-supplied cause. */
  STOP
}
