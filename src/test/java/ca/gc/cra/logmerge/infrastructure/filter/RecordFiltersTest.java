package ca.gc.cra.logmerge.infrastructure.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.logmerge.application.port.RecordFilter;
import ca.gc.cra.logmerge.domain.merge.Action;
import ca.gc.cra.logmerge.domain.merge.FilterResult;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class RecordFiltersTest {

  @Test
  void includeKeepsOnlyMatchingRecords() {
    RecordFilter filter = RecordFilters.include(Pattern.compile("ERROR|WARN"));

    assertEquals(Action.ACCEPT, apply(filter, "12:00 WARN disk").action());
    assertEquals(Action.SKIP, apply(filter, "12:00 INFO ok").action());
  }

  @Test
  void excludeDropsMatchingRecords() {
    RecordFilter filter = RecordFilters.exclude(Pattern.compile("healthcheck"));

    assertEquals(Action.SKIP, apply(filter, "GET /healthcheck 200").action());
    assertEquals(Action.ACCEPT, apply(filter, "GET /orders 200").action());
  }

  @Test
  void stopOnReportsSourceAndPattern() {
    RecordFilter filter = RecordFilters.stopOn(Pattern.compile("FATAL"));

    FilterResult result = filter.filter("db.log", bytes("x FATAL corrupted page"));

    assertEquals(Action.STOP, result.action());
    RecordFilters.StopPatternMatchedException cause =
        assertInstanceOf(RecordFilters.StopPatternMatchedException.class, result.cause());
    assertEquals("Record in db.log matched stop pattern /FATAL/", cause.getMessage());
    assertEquals(Action.ACCEPT, apply(filter, "x INFO fine").action());
  }

  @Test
  void tagSourcePrefixesLabel() {
    FilterResult result = RecordFilters.tagSource().filter("web-1.log", bytes("GET /"));

    assertEquals("[web-1.log] GET /", text(result.record()));
  }

  @Test
  void chainAppliesStepsInOrderAndFirstNonAcceptWins() {
    RecordFilter chain = RecordFilters.chain(List.of(
        RecordFilters.stopOn(Pattern.compile("PANIC")),
        RecordFilters.include(Pattern.compile("^\\[")),
        RecordFilters.tagSource()));

    assertEquals(Action.SKIP, apply(chain, "no bracket").action());
    assertEquals(Action.STOP, apply(chain, "[x] PANIC").action());
    assertEquals("[app] [x] ok", text(apply(chain, "[x] ok").record()));
  }

  @Test
  void chainOfOneIsTheFilterItself() {
    RecordFilter only = RecordFilters.tagSource();

    assertSame(only, RecordFilters.chain(List.of(only)));
  }

  @Test
  void patternsMatchUtf8Text() {
    RecordFilter filter = RecordFilters.include(Pattern.compile("café"));

    assertEquals(Action.ACCEPT, apply(filter, "ordered café au lait").action());
  }

  private static FilterResult apply(RecordFilter filter, String line) {
    return filter.filter("app", bytes(line));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
