package dev.podflow.validation;

/**
 * Numeric validation for configuration values.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name parameter name included in diagnostics; {@code value} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer and validates its range.
   *
   * @param name parameter name
   * @param text decimal text
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or out of range
   */
  public static int parseInt(String name, String text, int min, int max) {
    int value;
    try {
      value = Integer.parseInt(Strings.requireNonBlank(name, text));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + text + ")", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
