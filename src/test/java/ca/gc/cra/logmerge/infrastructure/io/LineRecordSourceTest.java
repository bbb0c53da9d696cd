package ca.gc.cra.logmerge.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LineRecordSourceTest {

  @Test
  void splitsOnNewlineAndStripsCarriageReturn() throws IOException {
    assertEquals(List.of("alpha", "beta", "gamma"), readAll("alpha\r\nbeta\ngamma\n", 1024));
  }

  @Test
  void returnsUnterminatedFinalLine() throws IOException {
    assertEquals(List.of("first", "tail"), readAll("first\ntail", 1024));
  }

  @Test
  void trailingNewlineDoesNotProduceAnEmptyRecord() throws IOException {
    assertEquals(List.of("only"), readAll("only\n", 1024));
    assertEquals(List.of(), readAll("", 1024));
  }

  @Test
  void emptyLinesInsideTheStreamAreKept() throws IOException {
    assertEquals(List.of("a", "", "", "b"), readAll("a\n\n\r\nb\n", 1024));
  }

  @Test
  void loneCarriageReturnInsideALineIsKept() throws IOException {
    assertEquals(List.of("a\rb"), readAll("a\rb\n", 1024));
  }

  @Test
  void recordAtTheLimitIsAccepted() throws IOException {
    assertEquals(List.of("abcd", "efgh"), readAll("abcd\r\nefgh", 4));
  }

  @Test
  void recordOverTheLimitFails() throws IOException {
    LineRecordSource source = source("ok\nabcdef\nnext\n", 4);

    assertEquals("ok", text(source.next()));
    IOException ex = assertThrows(IOException.class, source::next);
    assertTrue(ex.getMessage().contains("exceeds 4 bytes"), ex.getMessage());
  }

  @Test
  void unterminatedRecordOverTheLimitFailsWithoutReadingEverything() {
    LineRecordSource source = new LineRecordSource(
        "endless", new OneByteAtATime("x".repeat(100_000).getBytes(StandardCharsets.US_ASCII)), 16);

    assertThrows(IOException.class, source::next);
  }

  @Test
  void linesSpanningReadBoundariesAreReassembled() throws IOException {
    String first = "x".repeat(10_000);
    String second = "y".repeat(20_000);
    byte[] bytes = (first + "\r\n" + second + "\n" + "z").getBytes(StandardCharsets.US_ASCII);
    LineRecordSource source = new LineRecordSource("big", new OneByteAtATime(bytes), 32_000);

    assertEquals(first, text(source.next()));
    assertEquals(second, text(source.next()));
    assertEquals("z", text(source.next()));
    assertEquals(Optional.empty(), source.next());
  }

  @Test
  void manyShortLinesCompactTheBuffer() throws IOException {
    StringBuilder input = new StringBuilder();
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 20_000; i++) {
      String line = "line-" + i;
      expected.add(line);
      input.append(line).append('\n');
    }
    assertEquals(expected, readAll(input.toString(), 64));
  }

  @Test
  void closedSourceRejectsReads() throws IOException {
    LineRecordSource source = source("a\n", 16);
    source.close();

    assertThrows(IOException.class, source::next);
  }

  private static List<String> readAll(String input, int max) throws IOException {
    List<String> lines = new ArrayList<>();
    try (LineRecordSource source = source(input, max)) {
      Optional<byte[]> next;
      while ((next = source.next()).isPresent()) {
        lines.add(new String(next.get(), StandardCharsets.UTF_8));
      }
      assertEquals(Optional.empty(), source.next());
    }
    return lines;
  }

  private static LineRecordSource source(String input, int max) {
    return new LineRecordSource("test", new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), max);
  }

  private static String text(Optional<byte[]> record) {
    return new String(record.orElseThrow(), StandardCharsets.UTF_8);
  }

  /** Returns at most one byte per read call. */
  private static final class OneByteAtATime extends FilterInputStream {
    OneByteAtATime(byte[] bytes) {
      super(new ByteArrayInputStream(bytes));
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return super.read(b, off, Math.min(1, len));
    }
  }
}
