package io.github.jsontree;

import java.util.Objects;

/// A JSON string.
public record JsonString(String value) implements JsonValue {

  public JsonString {
    Objects.requireNonNull(value, "value");
  }

  public static JsonString of(String value) {
    return new JsonString(value);
  }

  @Override
  public String toString() {
    return quote(value);
  }

  /// Renders `s` as a quoted JSON string literal.
  static String quote(String s) {
    StringBuilder result = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      switch (ch) {
        case '"':
          result.append("\\\"");
          break;
        case '\\':
          result.append("\\\\");
          break;
        case '\b':
          result.append("\\b");
          break;
        case '\f':
          result.append("\\f");
          break;
        case '\n':
          result.append("\\n");
          break;
        case '\r':
          result.append("\\r");
          break;
        case '\t':
          result.append("\\t");
          break;
        default:
          if (ch < 0x20) {
            result.append("\\u").append(String.format("%04x", (int) ch));
          } else {
            result.append(ch);
          }
      }
    }
    return result.append('"').toString();
  }
}
