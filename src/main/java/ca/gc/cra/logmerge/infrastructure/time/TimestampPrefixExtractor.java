package ca.gc.cra.logmerge.infrastructure.time;

import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.Extraction;
import ca.gc.cra.logmerge.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keys records by a timestamp rendered at the very start of the line.
 *
 * <p>The prefix width is the length of the pattern rendered for a reference instant. Lines shorter
 * than that width, or whose prefix does not parse, are skipped. Keys are epoch seconds. Fields the
 * pattern leaves out take zero values: a missing year is year 0, a missing month or day is
 * January 1st, and a missing time of day is midnight in the configured zone. Month and day names
 * are always English.</p>
 *
 * <p>Instances keep a running count of unparseable lines and may be shared by worker threads.</p>
 *
 * @since 0.1.0
 */
public final class TimestampPrefixExtractor implements TimeExtractor {
  private static final Logger log = LoggerFactory.getLogger(TimestampPrefixExtractor.class);
  private static final LocalDateTime REFERENCE = LocalDateTime.of(2006, 1, 2, 15, 4, 5);
  private static final int DEFAULT_YEAR = 0;

  private final String pattern;
  private final ZoneId zone;
  private final DateTimeFormatter formatter;
  private final int width;
  private final MetricsPort metrics;
  private final LongAdder unparseable = new LongAdder();

  /**
   * Creates an extractor for {@code pattern} interpreted in {@code zone}.
   *
   * @param pattern {@link DateTimeFormatter} pattern, e.g. {@code yyyy/MM/dd HH:mm:ss}
   * @param zone zone applied when the prefix carries no offset
   * @param metrics receives {@code merge.time.unparseable}
   * @throws IllegalArgumentException if the pattern is invalid
   */
  public TimestampPrefixExtractor(String pattern, ZoneId zone, MetricsPort metrics) {
    this.pattern = Objects.requireNonNull(pattern, "pattern");
    this.zone = Objects.requireNonNull(zone, "zone");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.formatter = DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);
    this.width = formatter.format(REFERENCE.atZone(zone)).getBytes(StandardCharsets.UTF_8).length;
    if (width == 0) {
      throw new IllegalArgumentException("time pattern renders no characters: " + pattern);
    }
  }

  @Override
  public Extraction extract(byte[] record) {
    if (record.length < width) {
      return unparseable(record, "shorter than timestamp prefix");
    }
    String prefix = new String(record, 0, width, StandardCharsets.UTF_8);
    try {
      return Extraction.accept(resolve(formatter.parse(prefix)).toEpochSecond());
    } catch (DateTimeException ex) {
      return unparseable(record, ex.getMessage());
    }
  }

  private ZonedDateTime resolve(TemporalAccessor parsed) {
    LocalDate date = parsed.query(TemporalQueries.localDate());
    if (date == null) {
      date = LocalDate.of(
          field(parsed, ChronoField.YEAR, DEFAULT_YEAR),
          field(parsed, ChronoField.MONTH_OF_YEAR, 1),
          field(parsed, ChronoField.DAY_OF_MONTH, 1));
    }
    LocalTime time = parsed.query(TemporalQueries.localTime());
    ZoneId parsedZone = parsed.query(TemporalQueries.zone());
    return ZonedDateTime.of(
        date, time == null ? LocalTime.MIDNIGHT : time, parsedZone == null ? zone : parsedZone);
  }

  private static int field(TemporalAccessor parsed, ChronoField field, int fallback) {
    return parsed.isSupported(field) ? parsed.get(field) : fallback;
  }

  private Extraction unparseable(byte[] record, String reason) {
    unparseable.increment();
    metrics.increment("merge.time.unparseable");
    if (log.isDebugEnabled()) {
      log.debug("Skipping record without {} timestamp ({}): {}", pattern, reason, Logs.preview(record));
    }
    return Extraction.skip();
  }

  /**
   * Byte width of the timestamp prefix.
   *
   * @return prefix width in bytes
   */
  public int width() {
    return width;
  }

  /**
   * Number of records skipped so far because their prefix did not parse.
   *
   * @return unparseable record count
   */
  public long unparseableCount() {
    return unparseable.sum();
  }
}
