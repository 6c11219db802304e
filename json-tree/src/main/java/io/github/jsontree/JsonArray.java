package io.github.jsontree;

import java.util.List;
import java.util.stream.Collectors;

/// An ordered JSON array. The element list is unmodifiable.
public record JsonArray(List<JsonValue> elements) implements JsonValue {

  /// @throws NullPointerException if `elements` or any element is `null`
  public JsonArray {
    elements = List.copyOf(elements);
  }

  public static JsonArray of(List<? extends JsonValue> elements) {
    return new JsonArray(List.copyOf(elements));
  }

  public static JsonArray of(JsonValue... elements) {
    return new JsonArray(List.of(elements));
  }

  @Override
  public String toString() {
    return elements.stream().map(JsonValue::toString).collect(Collectors.joining(",", "[", "]"));
  }
}
