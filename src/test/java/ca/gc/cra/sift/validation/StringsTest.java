package ca.gc.cra.sift.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("auth.log", Strings.requireNonBlank("in", "  auth.log "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("in", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("in", null));
  }

  @Test
  void trimToNullCollapsesBlank() {
    assertNull(Strings.trimToNull("  "));
    assertNull(Strings.trimToNull(null));
    assertEquals("x", Strings.trimToNull(" x "));
  }
}
