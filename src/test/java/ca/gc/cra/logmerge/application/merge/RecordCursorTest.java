package ca.gc.cra.logmerge.application.merge;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logmerge.application.merge.HandlerAbortException.Stage;
import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.application.port.TimeExtractor;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import ca.gc.cra.logmerge.testutil.InMemoryRecordSource;
import ca.gc.cra.logmerge.testutil.TestExtractors;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RecordCursorTest {
  private static final TimeExtractor KEYED = TestExtractors.leadingNumber();

  @Test
  void advanceSkipsUnkeyedLinesAndCountsThem() throws Exception {
    RecordCursor cursor = new RecordCursor(
        InMemoryRecordSource.of("a", "banner", "", "7 first", "9 second"), 0, KEYED, null);

    cursor.advance();

    assertFalse(cursor.exhausted());
    assertEquals(7L, cursor.key());
    assertEquals("7 first", text(cursor.record()));
    assertEquals(2L, cursor.skipped());
  }

  @Test
  void exhaustedCursorHasNoRecord() throws Exception {
    RecordCursor cursor = new RecordCursor(InMemoryRecordSource.of("a", "1 only"), 3, KEYED, null);

    cursor.advance();
    cursor.advance();

    assertTrue(cursor.exhausted());
    assertNull(cursor.record());
    assertEquals(3, cursor.ordinal());
    assertEquals("a", cursor.label());
  }

  @Test
  void filterRewritesAcceptedRecordButKeepsExtractedKey() throws Exception {
    RecordFilter upper = (label, record) ->
        FilterResult.accept(text(record).toUpperCase().getBytes(StandardCharsets.UTF_8));
    RecordCursor cursor = new RecordCursor(InMemoryRecordSource.of("a", "5 quiet"), 0, KEYED, upper);

    cursor.advance();

    assertEquals(5L, cursor.key());
    assertArrayEquals("5 QUIET".getBytes(StandardCharsets.UTF_8), cursor.record());
  }

  @Test
  void filterSkipIsCountedAndNextRecordIsUsed() throws Exception {
    RecordFilter dropOdd = (label, record) ->
        text(record).endsWith("odd") ? FilterResult.skip() : FilterResult.accept(record);
    RecordCursor cursor = new RecordCursor(
        InMemoryRecordSource.of("a", "1 odd", "2 even"), 0, KEYED, dropOdd);

    cursor.advance();

    assertEquals(2L, cursor.key());
    assertEquals(1L, cursor.skipped());
  }

  @Test
  void extractorStopRaisesHandlerAbortWithCause() {
    RecordCursor cursor = new RecordCursor(InMemoryRecordSource.of("a", "STOP"), 0, KEYED, null);

    HandlerAbortException ex = assertThrows(HandlerAbortException.class, cursor::advance);

    assertEquals(Stage.TIME_EXTRACTOR, ex.stage());
    assertEquals("a", ex.sourceLabel().orElseThrow());
    assertInstanceOf(IllegalStateException.class, ex.getCause());
  }

  @Test
  void filterStopWithoutCauseStillAborts() {
    RecordFilter stopAll = (label, record) -> FilterResult.stop(null);
    RecordCursor cursor = new RecordCursor(InMemoryRecordSource.of("b", "1 x"), 0, KEYED, stopAll);

    HandlerAbortException ex = assertThrows(HandlerAbortException.class, cursor::advance);

    assertEquals(Stage.RECORD_FILTER, ex.stage());
    assertNull(ex.getCause());
  }

  @Test
  void throwingOrNullStrategiesAreTreatedAsStop() {
    IllegalArgumentException boom = new IllegalArgumentException("boom");
    TimeExtractor throwing = record -> {
      throw boom;
    };
    RecordCursor first = new RecordCursor(InMemoryRecordSource.of("a", "1 x"), 0, throwing, null);
    HandlerAbortException thrown = assertThrows(HandlerAbortException.class, first::advance);
    assertSame(boom, thrown.getCause());

    RecordCursor second = new RecordCursor(
        InMemoryRecordSource.of("a", "1 x"), 0, KEYED, (label, record) -> null);
    HandlerAbortException nulled = assertThrows(HandlerAbortException.class, second::advance);
    assertInstanceOf(NullPointerException.class, nulled.getCause());
  }

  @Test
  void readFailureBecomesSourceAccessException() {
    RecordCursor cursor = new RecordCursor(
        InMemoryRecordSource.failingAfter("broken", 0, "1 x"), 0, KEYED, null);

    SourceAccessException ex = assertThrows(SourceAccessException.class, cursor::advance);

    assertEquals("broken", ex.sourceLabel().orElseThrow());
    assertInstanceOf(IOException.class, ex.getCause());
  }

  @Test
  void uncheckedReadFailureIsStillASourceAccessException() throws Exception {
    RecordCursor cursor = new RecordCursor(
        InMemoryRecordSource.corruptAfter("archive.gz", 1, "1 first", "2 second"), 0, KEYED, null);
    cursor.advance();

    SourceAccessException ex = assertThrows(SourceAccessException.class, cursor::advance);

    assertEquals("archive.gz", ex.sourceLabel().orElseThrow());
    assertInstanceOf(UncheckedIOException.class, ex.getCause());
  }

  private static String text(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
