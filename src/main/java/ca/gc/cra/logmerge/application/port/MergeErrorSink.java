package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.domain.merge.SourceFailure;

/**
 * Error-reporting channel for per-source failures in concurrent mode.
 *
 * <p>Invoked from worker threads; implementations must be thread-safe and must not block for long,
 * since the reporting worker stops draining while the call is in progress.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MergeErrorSink {
  /**
   * Reports one source failure.
   *
   * @param failure failed source and its cause
   */
  void report(SourceFailure failure);
}
