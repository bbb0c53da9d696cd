package ca.gc.cra.logmerge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("merged.log", Strings.requireNonBlank("out", "  merged.log "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", " \t "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("out", null));
  }

  @Test
  void requireListSplitsAndDropsEmptyEntries() {
    assertEquals(List.of("a.log", "b.log"), Strings.requireList("in", " a.log, ,b.log ,"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireList("in", ", ,"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("team=ops", Strings.requirePrintableAscii("attrs", "team=ops", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "team=ops", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "équipe=ops", 64));
  }

  @Test
  void requirePatternCompilesOrExplains() {
    assertEquals("ERROR|WARN", Strings.requirePattern("include", "ERROR|WARN").pattern());
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePattern("include", "([a-"));
    assertTrue(ex.getMessage().startsWith("include is not a valid regular expression"));
  }
}
