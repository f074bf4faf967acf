package dev.podflow.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for CLI and configuration paths.
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a user-supplied path.
   *
   * @param name parameter name for diagnostics
   * @param value path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, contains control characters or is not a path
   */
  public static Path parse(String name, String value) {
    String text = Strings.requireNonBlank(name, value);
    try {
      return Path.of(text).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + text, ex);
    }
  }

  /**
   * Ensures a directory exists and is writable, creating it when missing.
   *
   * @param path directory path
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a file, cannot be created or is not writable
   */
  public static Path ensureWritableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      Files.createDirectories(normalized);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }
}
