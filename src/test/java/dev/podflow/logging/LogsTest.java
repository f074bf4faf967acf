package dev.podflow.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("hello", Logs.truncate("hello", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateNotesOriginalLength() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncateDoesNotSplitSurrogatePairs() {
    String value = "ab🎙cd";
    assertEquals("ab... (truncated, 2 of 6)", Logs.truncate(value, 3));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactMasksSecrets() {
    assertEquals("[REDACTED]", Logs.redact("short"));
    assertEquals("[REDACTED]...wxyz", Logs.redact("sk-ant-abcdefwxyz"));
    assertEquals("<null>", Logs.redact(" "));
  }
}
