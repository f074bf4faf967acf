package dev.podflow.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers.
 * <p><strong>Why:</strong> Keeps transcripts and model replies from flooding logs and API credentials out of them.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int VISIBLE_SECRET_SUFFIX = 4;
  private static final int MIN_PARTIAL_SECRET = 12;

  private Logs() {
    // Utility
  }

  /**
   * Truncates text to a character budget, noting the original length.
   *
   * @param value text to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return the original value when short enough, otherwise a prefix with a {@code (truncated, X of Y)} suffix
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + end + " of " + value.length() + ")";
  }

  /**
   * Masks a credential. Long secrets keep their last four characters so operators can tell keys apart.
   *
   * @param value secret; {@code null} or blank yields {@code <null>}
   * @return masked value such as {@code [REDACTED]...abcd}
   */
  public static String redact(String value) {
    if (value == null || value.isBlank()) {
      return NULL_PLACEHOLDER;
    }
    if (value.length() < MIN_PARTIAL_SECRET) {
      return REDACTED_PLACEHOLDER;
    }
    return REDACTED_PLACEHOLDER + "..." + value.substring(value.length() - VISIBLE_SECRET_SUFFIX);
  }
}
