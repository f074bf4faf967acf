package dev.podflow.infrastructure.http;

/**
 * Status and body of a completed HTTP exchange.
 *
 * @param status HTTP status code
 * @param body response body; empty when the server sent none
 * @since 0.1.0
 */
public record HttpResponseData(int status, String body) {
  public HttpResponseData {
    body = body == null ? "" : body;
  }

  /**
   * Indicates a 2xx status.
   *
   * @return {@code true} for 200 to 299
   */
  public boolean isSuccess() {
    return status >= 200 && status < 300;
  }

  /**
   * Formats the status and an excerpt of the body for error messages.
   *
   * @param platform label prefixed to the message
   * @return message such as {@code art19 API error: 422 - {...}}
   */
  public String describeError(String platform) {
    String excerpt = body.length() > 200 ? body.substring(0, 200) + "..." : body;
    return platform + " API error: " + status + (excerpt.isBlank() ? "" : " - " + excerpt);
  }
}
