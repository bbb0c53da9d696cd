package ca.gc.cra.logmerge.domain.merge;

import java.util.Locale;

/**
 * Selects how sources are drained.
 *
 * @since 0.1.0
 */
public enum MergeMode {
  /** Single-threaded k-way merge producing globally time-ordered output. */
  ORDERED,
  /** Parallel drain of every source with no ordering across sources. */
  CONCURRENT;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw mode name; blank values resolve to {@link #ORDERED}
   * @return parsed mode
   * @throws IllegalArgumentException when the name is unknown
   */
  public static MergeMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return ORDERED;
    }
    try {
      return MergeMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("mode must be ORDERED or CONCURRENT (was " + raw + ")", ex);
    }
  }
}
