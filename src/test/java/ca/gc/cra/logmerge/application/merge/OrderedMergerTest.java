package ca.gc.cra.logmerge.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import ca.gc.cra.logmerge.domain.merge.MergeMode;
import ca.gc.cra.logmerge.domain.merge.MergeReport;
import ca.gc.cra.logmerge.testutil.InMemoryRecordSink;
import ca.gc.cra.logmerge.testutil.InMemoryRecordSource;
import ca.gc.cra.logmerge.testutil.RecordingMetricsPort;
import ca.gc.cra.logmerge.testutil.TestExtractors;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrderedMergerTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final OrderedMerger merger = new OrderedMerger(metrics);
  private final InMemoryRecordSink sink = new InMemoryRecordSink();

  @Test
  void interleavesSourcesByKey() throws Exception {
    MergeReport report = merger.run(
        List.of(
            InMemoryRecordSource.of("one", "1 A", "3 C"),
            InMemoryRecordSource.of("two", "2 B", "4 D")),
        sink,
        TestExtractors.leadingNumber(),
        null);

    assertEquals(List.of("1 A", "2 B", "3 C", "4 D"), sink.records());
    assertEquals(4, sink.flushes());
    assertEquals(MergeMode.ORDERED, report.mode());
    assertEquals(4L, report.recordsWritten());
    assertTrue(report.complete());
  }

  @Test
  void equalKeysFollowSourceOrder() throws Exception {
    merger.run(
        List.of(
            InMemoryRecordSource.of("first", "5 first-a", "5 first-b"),
            InMemoryRecordSource.of("second", "5 second-a"),
            InMemoryRecordSource.of("third", "4 third-a", "5 third-b")),
        sink,
        TestExtractors.leadingNumber(),
        null);

    assertEquals(
        List.of("4 third-a", "5 first-a", "5 first-b", "5 second-a", "5 third-b"),
        sink.records());
  }

  @Test
  void outputIsNonDecreasingForManySources() throws Exception {
    merger.run(
        List.of(
            InMemoryRecordSource.numbered("a", 200, 0, 3),
            InMemoryRecordSource.numbered("b", 150, 1, 4),
            InMemoryRecordSource.numbered("c", 0, 0, 1),
            InMemoryRecordSource.numbered("d", 300, 2, 2)),
        sink,
        TestExtractors.leadingNumber(),
        null);

    List<String> records = sink.records();
    assertEquals(650, records.size());
    long previous = Long.MIN_VALUE;
    for (String record : records) {
      long key = Long.parseLong(record.substring(0, record.indexOf(' ')));
      assertTrue(key >= previous, "key " + key + " emitted after " + previous);
      previous = key;
    }
  }

  @Test
  void skippedRecordsAreCountedAndNotWritten() throws Exception {
    RecordFilter dropDebug = (label, record) ->
        new String(record, StandardCharsets.UTF_8).contains("DEBUG") ? FilterResult.skip() : FilterResult.accept(record);

    MergeReport report = merger.run(
        List.of(
            InMemoryRecordSource.of("a", "header", "1 INFO up", "2 DEBUG noise"),
            InMemoryRecordSource.of("b", "3 INFO done")),
        sink,
        TestExtractors.leadingNumber(),
        dropDebug);

    assertEquals(List.of("1 INFO up", "3 INFO done"), sink.records());
    assertEquals(2L, report.recordsWritten());
    assertEquals(2L, report.recordsSkipped());
    assertEquals(List.of(2L), metrics.observed("merge.ordered.records.skipped"));
  }

  @Test
  void stopLeavesOnlyRecordsFlushedBeforeIt() {
    HandlerAbortException ex = assertThrows(HandlerAbortException.class, () -> merger.run(
        List.of(
            InMemoryRecordSource.of("src1", "1 A", "STOP", "5 E"),
            InMemoryRecordSource.of("src2", "2 B", "3 C")),
        sink,
        TestExtractors.leadingNumber(),
        null));

    assertEquals("src1", ex.sourceLabel().orElseThrow());
    assertEquals(List.of("1 A"), sink.records());
    assertEquals(1, sink.flushes());
  }

  @Test
  void uncheckedReadFailureAbortsAsSourceAccess() {
    SourceAccessException ex = assertThrows(SourceAccessException.class, () -> merger.run(
        List.of(
            InMemoryRecordSource.corruptAfter("archive.gz", 1, "1 A", "4 D"),
            InMemoryRecordSource.of("plain", "2 B", "3 C")),
        sink,
        TestExtractors.leadingNumber(),
        null));

    assertEquals("archive.gz", ex.sourceLabel().orElseThrow());
    assertInstanceOf(UncheckedIOException.class, ex.getCause());
    assertEquals(List.of("1 A"), sink.records());
  }

  @Test
  void stopWhilePrimingWritesNothing() {
    assertThrows(HandlerAbortException.class, () -> merger.run(
        List.of(InMemoryRecordSource.of("a", "1 A"), InMemoryRecordSource.of("b", "STOP")),
        sink,
        TestExtractors.leadingNumber(),
        null));

    assertEquals(List.of(), sink.records());
  }

  @Test
  void emptyInputProducesEmptyOutput() throws Exception {
    MergeReport report = merger.run(
        List.of(InMemoryRecordSource.of("a"), InMemoryRecordSource.of("b")),
        sink,
        TestExtractors.leadingNumber(),
        null);

    assertEquals(0L, report.recordsWritten());
    assertEquals(List.of(), sink.records());

    MergeReport none = merger.run(List.of(), sink, TestExtractors.leadingNumber(), null);
    assertEquals(0L, none.recordsWritten());
  }

  @Test
  void missingTimeExtractorIsAConfigurationError() {
    assertThrows(ConfigurationException.class, () -> merger.run(
        List.of(InMemoryRecordSource.of("a", "1 A")), sink, null, null));
    assertEquals(0, sink.flushes());
  }

  @Test
  void readFailureSurfacesWithSourceLabel() {
    SourceAccessException ex = assertThrows(SourceAccessException.class, () -> merger.run(
        List.of(
            InMemoryRecordSource.of("good", "1 A", "4 D"),
            InMemoryRecordSource.failingAfter("bad", 1, "2 B", "3 C")),
        sink,
        TestExtractors.leadingNumber(),
        null));

    assertEquals("bad", ex.sourceLabel().orElseThrow());
    assertEquals(List.of("1 A"), sink.records());
  }

  @Test
  void destinationFailureStopsTheMerge() {
    InMemoryRecordSink failing = new InMemoryRecordSink(2);

    DestinationException ex = assertThrows(DestinationException.class, () -> merger.run(
        List.of(InMemoryRecordSource.of("a", "1 A", "2 B", "3 C")),
        failing,
        TestExtractors.leadingNumber(),
        null));

    assertInstanceOf(IOException.class, ex.getCause());
    assertEquals(List.of("1 A"), failing.records());
  }

  @Test
  void recordsWrittenCounterAndFrontierSizeAreReported() throws Exception {
    merger.run(
        List.of(
            InMemoryRecordSource.of("a", "1 A"),
            InMemoryRecordSource.of("b", "2 B"),
            InMemoryRecordSource.of("c")),
        sink,
        TestExtractors.leadingNumber(),
        null);

    assertEquals(2L, metrics.count("merge.ordered.records.written"));
    assertEquals(List.of(2L), metrics.observed("merge.frontier.size"));
  }
}
