package ca.gc.cra.logmerge.infrastructure.time;

import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.Extraction;

/**
 * Stateless {@link TimeExtractor}s for records that start with a numeric epoch timestamp.
 *
 * <p>Leading spaces are ignored. A record without leading digits, or whose number overflows a
 * {@code long}, is skipped.</p>
 *
 * @since 0.1.0
 */
public final class TimeExtractors {
  private TimeExtractors() {
    // Utility
  }

  /**
   * Keys records by the leading integer, read as epoch seconds. Any fractional part is ignored.
   *
   * @return extractor keyed in seconds
   */
  public static TimeExtractor epochSeconds() {
    return record -> {
      int start = skipSpaces(record);
      int end = digitsEnd(record, start);
      if (end == start) {
        return Extraction.skip();
      }
      long seconds = parse(record, start, end);
      return seconds < 0 ? Extraction.skip() : Extraction.accept(seconds);
    };
  }

  /**
   * Keys records by epoch milliseconds. Accepts either an integer millisecond count
   * ({@code 1700000000123}) or seconds with a fraction ({@code 1700000000.123}).
   *
   * @return extractor keyed in milliseconds
   */
  public static TimeExtractor epochMillis() {
    return record -> {
      int start = skipSpaces(record);
      int end = digitsEnd(record, start);
      if (end == start) {
        return Extraction.skip();
      }
      long whole = parse(record, start, end);
      if (whole < 0) {
        return Extraction.skip();
      }
      if (end >= record.length || record[end] != '.') {
        return Extraction.accept(whole);
      }
      long millis = 0;
      int scale = 100;
      for (int i = end + 1; i < record.length && isDigit(record[i]) && scale > 0; i++) {
        millis += (record[i] - '0') * (long) scale;
        scale /= 10;
      }
      if (whole > (Long.MAX_VALUE - millis) / 1000L) {
        return Extraction.skip();
      }
      return Extraction.accept(whole * 1000L + millis);
    };
  }

  private static int skipSpaces(byte[] record) {
    int i = 0;
    while (i < record.length && (record[i] == ' ' || record[i] == '\t')) {
      i++;
    }
    return i;
  }

  private static int digitsEnd(byte[] record, int start) {
    int i = start;
    while (i < record.length && isDigit(record[i])) {
      i++;
    }
    return i;
  }

  /** Returns -1 on overflow. */
  private static long parse(byte[] record, int start, int end) {
    long value = 0;
    for (int i = start; i < end; i++) {
      int digit = record[i] - '0';
      if (value > (Long.MAX_VALUE - digit) / 10L) {
        return -1L;
      }
      value = value * 10L + digit;
    }
    return value;
  }

  private static boolean isDigit(byte b) {
    return b >= '0' && b <= '9';
  }
}
