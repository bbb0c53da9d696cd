package ca.gc.cra.logmerge.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.logmerge.application.port.MetricsPort;
import ca.gc.cra.logmerge.domain.merge.Action;
import ca.gc.cra.logmerge.domain.merge.Extraction;
import ca.gc.cra.logmerge.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class TimestampPrefixExtractorTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void parsesDefaultLayoutAsUtcSeconds() {
    TimestampPrefixExtractor extractor =
        new TimestampPrefixExtractor("yyyy-MM-dd HH:mm:ss", ZoneOffset.UTC, metrics);

    Extraction extraction = extract(extractor, "2024-03-01 12:00:05 INFO service started");

    assertEquals(Action.ACCEPT, extraction.action());
    assertEquals(ZonedDateTime.of(2024, 3, 1, 12, 0, 5, 0, ZoneOffset.UTC).toEpochSecond(), extraction.key());
    assertEquals(19, extractor.width());
  }

  @Test
  void appliesConfiguredZone() {
    ZoneId toronto = ZoneId.of("America/Toronto");
    TimestampPrefixExtractor extractor = new TimestampPrefixExtractor("yyyy-MM-dd HH:mm:ss", toronto, metrics);

    Extraction extraction = extract(extractor, "2024-07-01 08:00:00 x");

    assertEquals(ZonedDateTime.of(2024, 7, 1, 8, 0, 0, 0, toronto).toEpochSecond(), extraction.key());
  }

  @Test
  void dateOnlyLayoutKeysByStartOfDay() {
    TimestampPrefixExtractor extractor = new TimestampPrefixExtractor("yyyy-MM-dd", ZoneOffset.UTC, metrics);

    assertEquals(10, extractor.width());
    assertEquals(
        ZonedDateTime.of(2024, 1, 2, 0, 0, 0, 0, ZoneOffset.UTC).toEpochSecond(),
        extract(extractor, "2024-01-02 rest").key());
  }

  @Test
  void syslogLayoutWithoutYearDefaultsToYearZero() {
    TimestampPrefixExtractor extractor = new TimestampPrefixExtractor("MMM dd HH:mm:ss", ZoneOffset.UTC, metrics);

    Extraction extraction = extract(extractor, "Oct 11 22:14:15 host sshd[42]: session opened");

    assertEquals(Action.ACCEPT, extraction.action());
    assertEquals(ZonedDateTime.of(0, 10, 11, 22, 14, 15, 0, ZoneOffset.UTC).toEpochSecond(), extraction.key());
    assertEquals(
        Action.ACCEPT, extract(extractor, "Feb 29 00:00:01 host kernel: leap day").action());
  }

  @Test
  void timeOnlyLayoutKeysWithinDefaultDay() {
    TimestampPrefixExtractor extractor = new TimestampPrefixExtractor("HH:mm:ss", ZoneOffset.UTC, metrics);

    Extraction early = extract(extractor, "08:00:00 INFO started");
    Extraction late = extract(extractor, "22:14:15 INFO stopped");

    assertEquals(Action.ACCEPT, early.action());
    assertEquals(ZonedDateTime.of(0, 1, 1, 22, 14, 15, 0, ZoneOffset.UTC).toEpochSecond(), late.key());
    assertEquals(14L * 3600 + 14 * 60 + 15, late.key() - early.key());
    assertEquals(0L, extractor.unparseableCount());
  }

  @Test
  void monthNamesParseInEnglishWhateverTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.FRANCE);
    try {
      TimestampPrefixExtractor extractor =
          new TimestampPrefixExtractor("dd/MMM/yyyy:HH:mm:ss", ZoneOffset.UTC, metrics);

      Extraction extraction = extract(extractor, "10/Oct/2023:13:55:36 GET /index.html");

      assertEquals(20, extractor.width());
      assertEquals(Action.ACCEPT, extraction.action());
      assertEquals(ZonedDateTime.of(2023, 10, 10, 13, 55, 36, 0, ZoneOffset.UTC).toEpochSecond(), extraction.key());
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void parsedOffsetWinsOverConfiguredZone() {
    TimestampPrefixExtractor extractor =
        new TimestampPrefixExtractor("yyyy-MM-dd'T'HH:mm:ssxxx", ZoneId.of("America/Toronto"), metrics);

    Extraction extraction = extract(extractor, "2024-07-01T08:00:00+02:00 request");

    assertEquals(25, extractor.width());
    assertEquals(ZonedDateTime.of(2024, 7, 1, 6, 0, 0, 0, ZoneOffset.UTC).toEpochSecond(), extraction.key());
  }

  @Test
  void unparseablePrefixesAreSkippedAndCounted() {
    TimestampPrefixExtractor extractor =
        new TimestampPrefixExtractor("yyyy-MM-dd HH:mm:ss", ZoneOffset.UTC, metrics);

    assertEquals(Action.SKIP, extract(extractor, "short").action());
    assertEquals(Action.SKIP, extract(extractor, "Exception in thread main java.lang.Error").action());
    assertEquals(Action.SKIP, extract(extractor, "2024-13-01 00:00:00 bad month").action());

    assertEquals(3L, extractor.unparseableCount());
    assertEquals(3L, metrics.count("merge.time.unparseable"));
  }

  @Test
  void rejectsInvalidPatterns() {
    assertThrows(IllegalArgumentException.class,
        () -> new TimestampPrefixExtractor("yyyy-MM-dd {{", ZoneOffset.UTC, MetricsPort.NO_OP));
  }

  private static Extraction extract(TimestampPrefixExtractor extractor, String line) {
    return extractor.extract(line.getBytes(StandardCharsets.UTF_8));
  }
}
