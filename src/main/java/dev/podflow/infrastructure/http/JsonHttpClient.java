package dev.podflow.infrastructure.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper over {@link HttpClient} for JSON request/response exchanges with a per-request timeout, plus the
 * one multipart file upload the host platform needs.
 * <p><strong>Thread-safety:</strong> Thread-safe; the underlying client is shared by all connectors.</p>
 *
 * @since 0.1.0
 */
public final class JsonHttpClient {
  private static final Logger log = LoggerFactory.getLogger(JsonHttpClient.class);
  private static final String USER_AGENT = "podflow/0.1";

  private final HttpClient client;

  /**
   * Creates an HTTP/1.1 client with the given connect timeout.
   *
   * @param connectTimeout TCP connect timeout
   */
  public JsonHttpClient(Duration connectTimeout) {
    this(HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  /**
   * Creates a wrapper around an existing client.
   *
   * @param client HTTP client
   */
  public JsonHttpClient(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  /**
   * Sends a request with a JSON body.
   *
   * @param method HTTP method such as {@code POST} or {@code PATCH}
   * @param uri target URI
   * @param json request body; {@code null} sends no body
   * @param contentType media type of the body
   * @param headers extra headers
   * @param timeout request timeout
   * @return status and body
   * @throws IOException on transport failure or timeout
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public HttpResponseData send(
      String method,
      URI uri,
      String json,
      String contentType,
      Map<String, String> headers,
      Duration timeout) throws IOException, InterruptedException {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Accept", contentType)
        .header("User-Agent", USER_AGENT);
    if (json == null) {
      builder.method(method, HttpRequest.BodyPublishers.noBody());
    } else {
      builder.header("Content-Type", contentType);
      builder.method(method, HttpRequest.BodyPublishers.ofString(json));
    }
    headers.forEach(builder::header);
    log.debug("{} {}", method, uri);
    HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    log.debug("{} {} -> {}", method, uri, response.statusCode());
    return new HttpResponseData(response.statusCode(), response.body());
  }

  /**
   * Sends a JSON {@code POST}.
   *
   * @param uri target URI
   * @param json request body
   * @param headers extra headers
   * @param timeout request timeout
   * @return status and body
   * @throws IOException on transport failure or timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public HttpResponseData postJson(URI uri, String json, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException {
    return send("POST", uri, json, "application/json", headers, timeout);
  }

  /**
   * Uploads a file as {@code multipart/form-data}, sending the form fields before the file part.
   *
   * @param uri upload target, typically a pre-signed storage URL
   * @param fields form fields required by the target, sent in iteration order
   * @param fileField name of the file part
   * @param file file to stream
   * @param fileContentType media type of the file part
   * @param timeout request timeout
   * @return status and body
   * @throws IOException if the file cannot be read, or on transport failure or timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public HttpResponseData uploadFile(
      URI uri,
      Map<String, String> fields,
      String fileField,
      Path file,
      String fileContentType,
      Duration timeout) throws IOException, InterruptedException {
    String boundary = "podflow-" + UUID.randomUUID();
    StringBuilder head = new StringBuilder();
    fields.forEach((name, value) -> head.append("--").append(boundary).append("\r\n")
        .append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n")
        .append(value).append("\r\n"));
    head.append("--").append(boundary).append("\r\n")
        .append("Content-Disposition: form-data; name=\"").append(fileField)
        .append("\"; filename=\"").append(file.getFileName()).append("\"\r\n")
        .append("Content-Type: ").append(fileContentType).append("\r\n\r\n");
    String tail = "\r\n--" + boundary + "--\r\n";

    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("User-Agent", USER_AGENT)
        .header("Content-Type", "multipart/form-data; boundary=" + boundary)
        .POST(HttpRequest.BodyPublishers.concat(
            HttpRequest.BodyPublishers.ofString(head.toString(), StandardCharsets.UTF_8),
            HttpRequest.BodyPublishers.ofFile(file),
            HttpRequest.BodyPublishers.ofString(tail, StandardCharsets.UTF_8)))
        .build();
    log.debug("POST {} (multipart, {})", uri, file.getFileName());
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
    log.debug("POST {} -> {}", uri, response.statusCode());
    return new HttpResponseData(response.statusCode(), response.body());
  }
}
