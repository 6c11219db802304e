package io.github.jsontree;

/// The interface that represents a JSON value.
///
/// The same tree shape is used for the data being validated and for the
/// schema that describes it. Instances are immutable and thread safe.
///
/// Equality is structural and deep: numbers compare by numeric value,
/// strings case-sensitively, arrays element by element in order and objects
/// as unordered maps of member name to value.
///
/// ## Example Usage
/// ```java
/// JsonValue value = Json.parse("{\"name\":\"Alice\",\"tags\":[1,2]}");
/// if (value instanceof JsonObject obj) {
///     JsonValue name = obj.members().get("name");
/// }
/// ```
///
/// `toString()` renders the value as JSON text.
public sealed interface JsonValue
    permits JsonNull, JsonBoolean, JsonNumber, JsonString, JsonArray, JsonObject {

  /// {@return the JSON text of this value}
  @Override
  String toString();
}
