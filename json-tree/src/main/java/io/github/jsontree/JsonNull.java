package io.github.jsontree;

/// The JSON `null` literal.
public record JsonNull() implements JsonValue {

  private static final JsonNull INSTANCE = new JsonNull();

  /// {@return the shared `null` value}
  public static JsonNull of() {
    return INSTANCE;
  }

  @Override
  public String toString() {
    return "null";
  }
}
