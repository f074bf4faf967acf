package dev.podflow.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("title", "   "));
    assertEquals("title must not be blank", ex.getMessage());
  }

  @Test
  void optionalTreatsBlankAsAbsent() {
    assertEquals(Optional.empty(), Strings.optional("  "));
    assertEquals(Optional.empty(), Strings.optional(null));
    assertEquals(Optional.of("x"), Strings.optional(" x "));
  }

  @Test
  void parseBooleanIsStrict() {
    assertTrue(Strings.parseBoolean("flag", "TRUE", false));
    assertFalse(Strings.parseBoolean("flag", "false", true));
    assertTrue(Strings.parseBoolean("flag", "", true));
    assertThrows(IllegalArgumentException.class, () -> Strings.parseBoolean("flag", "1", false));
  }
}
