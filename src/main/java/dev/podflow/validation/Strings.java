package dev.podflow.validation;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> String validation for configuration and CLI values.
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics; {@code value} when {@code null}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Treats {@code null} and blank values as absent.
   *
   * @param value candidate text
   * @return trimmed value, if non-blank
   */
  public static Optional<String> optional(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  /**
   * Parses a strict boolean.
   *
   * @param name parameter name for diagnostics
   * @param value {@code true}/{@code false} in any case, or blank for the default
   * @param defaultValue value used when blank
   * @return parsed flag
   * @throws IllegalArgumentException for any other text
   */
  public static boolean parseBoolean(String name, String value, boolean defaultValue) {
    Optional<String> text = optional(value);
    if (text.isEmpty()) {
      return defaultValue;
    }
    if ("true".equalsIgnoreCase(text.get())) {
      return true;
    }
    if ("false".equalsIgnoreCase(text.get())) {
      return false;
    }
    throw new IllegalArgumentException(message(name, "must be true or false (was " + text.get() + ")"));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
