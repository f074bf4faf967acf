package dev.podflow.infrastructure.publish;

import java.net.URI;

/** URI helpers shared by the connectors. */
final class Endpoints {
  private Endpoints() {}

  static URI append(URI base, String path) {
    String text = base.toString();
    while (text.endsWith("/")) {
      text = text.substring(0, text.length() - 1);
    }
    return URI.create(text + (path.startsWith("/") ? path : "/" + path));
  }
}
