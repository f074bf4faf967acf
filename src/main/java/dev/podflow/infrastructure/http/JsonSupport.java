package dev.podflow.infrastructure.http;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Minimal JSON helper on the Jackson streaming API: parses documents into {@link Map}/{@link List} graphs and
 * writes request bodies through a {@link JsonGenerator}.
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Callback writing one JSON document.
   */
  @FunctionalInterface
  public interface Writer {
    /**
     * Writes the document.
     *
     * @param gen generator positioned before the root value
     * @throws IOException if writing fails
     */
    void write(JsonGenerator gen) throws IOException;
  }

  /**
   * Parses the supplied JSON string into an object graph of maps, lists and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty map for an empty document
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Renders a document to a string.
   *
   * @param writer document writer
   * @return JSON text
   */
  public String write(Writer writer) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writer.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return out.toString();
  }

  /**
   * Walks nested objects by field name.
   *
   * @param root parsed graph
   * @param path field names from the root
   * @return value at the path, if every step is an object containing the field
   */
  public static Optional<Object> at(Object root, String... path) {
    Object node = root;
    for (String field : path) {
      if (!(node instanceof Map<?, ?> map)) {
        return Optional.empty();
      }
      node = map.get(field);
    }
    return Optional.ofNullable(node);
  }

  /**
   * Reads a scalar at the path as text.
   *
   * @param root parsed graph
   * @param path field names from the root
   * @return non-blank text, if the path ends at a string or number
   */
  public static Optional<String> text(Object root, String... path) {
    return at(root, path)
        .filter(v -> v instanceof String || v instanceof Number || v instanceof Boolean)
        .map(Object::toString)
        .filter(s -> !s.isBlank());
  }

  /**
   * Writes a string field only when the value is present.
   *
   * @param gen generator inside an object
   * @param name field name
   * @param value optional value
   * @throws IOException if writing fails
   */
  public static void writeOptional(JsonGenerator gen, String name, Optional<?> value) throws IOException {
    if (value.isEmpty()) {
      return;
    }
    Object v = value.get();
    if (v instanceof Number n) {
      gen.writeNumberField(name, n.longValue());
    } else if (v instanceof Boolean b) {
      gen.writeBooleanField(name, b);
    } else {
      gen.writeStringField(name, v.toString());
    }
  }

  /**
   * Writes an array of strings.
   *
   * @param gen generator inside an object
   * @param name field name
   * @param values values to write
   * @throws IOException if writing fails
   */
  public static void writeStringArray(JsonGenerator gen, String name, List<String> values) throws IOException {
    gen.writeArrayFieldStart(name);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
