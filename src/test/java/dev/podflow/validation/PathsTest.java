package dev.podflow.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void parseReturnsAbsoluteNormalizedPath() {
    Path parsed = Paths.parse("audio", tempDir.resolve("a/../show.wav").toString());
    assertEquals(tempDir.resolve("show.wav").toAbsolutePath(), parsed);
  }

  @Test
  void parseRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("audio", " "));
  }

  @Test
  void ensureWritableDirCreatesMissingDirectories() {
    Path dir = tempDir.resolve("work/nested");
    Path validated = Paths.ensureWritableDir(dir);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void ensureWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("file.txt"));
    assertThrows(IllegalArgumentException.class, () -> Paths.ensureWritableDir(file));
  }
}
