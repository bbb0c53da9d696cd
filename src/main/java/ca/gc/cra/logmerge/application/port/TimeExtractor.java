package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.domain.merge.Extraction;

/**
 * Strategy deciding the sort key of each raw record, or whether to skip it or stop.
 *
 * <p>Implementations are either pure functions (see {@code TimeExtractors}) or stateful adapters
 * owning their own context (see {@code TimestampPrefixExtractor}). In concurrent mode one
 * extractor instance may be invoked from several worker threads.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TimeExtractor {
  /**
   * Extracts the sort key of {@code record}.
   *
   * @param record raw record bytes; callers must not rely on the array being retained
   * @return extraction outcome; never {@code null}
   */
  Extraction extract(byte[] record);
}
