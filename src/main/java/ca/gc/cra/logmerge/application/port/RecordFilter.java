package ca.gc.cra.logmerge.application.port;

import ca.gc.cra.logmerge.domain.merge.FilterResult;

/**
 * Optional strategy applied to records after they have been accepted by the {@link TimeExtractor}.
 * May rewrite, skip, or stop.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordFilter {
  /**
   * Filters one accepted record.
   *
   * @param sourceLabel label of the source that produced the record
   * @param record raw record bytes
   * @return filter outcome; never {@code null}
   */
  FilterResult filter(String sourceLabel, byte[] record);
}
