package dev.podflow.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedDocuments() {
    Object root = json.parse("{\"data\":{\"id\":7,\"tags\":[\"a\",null,true],\"name\":\" \"}}");

    assertEquals(Optional.of("7"), JsonSupport.text(root, "data", "id"));
    assertEquals(Optional.empty(), JsonSupport.text(root, "data", "name"));
    assertEquals(Optional.empty(), JsonSupport.text(root, "data", "tags"));
    assertEquals(Optional.empty(), JsonSupport.at(root, "data", "id", "deeper"));
    List<?> tags = (List<?>) JsonSupport.at(root, "data", "tags").orElseThrow();
    assertEquals(3, tags.size());
  }

  @Test
  void emptyDocumentIsAnEmptyObject() {
    assertEquals(Map.of(), json.parse(""));
  }

  @Test
  void rejectsMalformedAndTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertEquals("JSON document contains trailing content", ex.getMessage());
  }

  @Test
  void writesOptionalFieldsOnlyWhenPresent() {
    String text = json.write(gen -> {
      gen.writeStartObject();
      JsonSupport.writeOptional(gen, "present", Optional.of("x"));
      JsonSupport.writeOptional(gen, "count", Optional.of(3));
      JsonSupport.writeOptional(gen, "absent", Optional.empty());
      JsonSupport.writeStringArray(gen, "tags", List.of("a", "b"));
      gen.writeEndObject();
    });

    assertEquals("{\"present\":\"x\",\"count\":3,\"tags\":[\"a\",\"b\"]}", text);
    assertTrue(JsonSupport.at(json.parse(text), "absent").isEmpty());
  }
}
