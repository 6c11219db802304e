package io.github.jsontree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// A JSON object.
///
/// Members keep the insertion order of the source map for iteration and
/// rendering, but order plays no part in equality.
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

  /// @throws NullPointerException if `members`, any name or any value is `null`
  public JsonObject {
    Map<String, JsonValue> copy = new LinkedHashMap<>();
    members.forEach((name, value) -> copy.put(Objects.requireNonNull(name, "member name"),
        Objects.requireNonNull(value, "member value")));
    members = Collections.unmodifiableMap(copy);
  }

  public static JsonObject of(Map<String, ? extends JsonValue> members) {
    return new JsonObject(new LinkedHashMap<>(members));
  }

  @Override
  public String toString() {
    return members.entrySet().stream()
        .map(e -> JsonString.quote(e.getKey()) + ":" + e.getValue())
        .collect(Collectors.joining(",", "{", "}"));
  }
}
