package dev.podflow.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Network address validation for endpoint settings.
 *
 * @since 0.1.0
 */
public final class Net {
  private Net() {
    // Utility
  }

  /**
   * Parses an absolute {@code http} or {@code https} URL.
   *
   * @param name setting name for diagnostics
   * @param value URL text
   * @return parsed URI
   * @throws IllegalArgumentException if the text is not an absolute HTTP(S) URL with a host
   */
  public static URI requireHttpUrl(String name, String value) {
    String text = Strings.requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(text);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + text, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https: " + text);
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host: " + text);
    }
    return uri;
  }
}
