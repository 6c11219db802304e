package io.github.jsontree.schema;

import io.github.jsontree.JsonArray;
import io.github.jsontree.JsonBoolean;
import io.github.jsontree.JsonNull;
import io.github.jsontree.JsonNumber;
import io.github.jsontree.JsonObject;
import io.github.jsontree.JsonString;
import io.github.jsontree.JsonValue;

import java.util.Locale;
import java.util.Optional;

/// Type names accepted by the `type` and `disallow` keywords.
enum JsonType {
  STRING {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonString;
    }
  },
  NUMBER {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonNumber;
    }
  },
  INTEGER {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonNumber number && number.isIntegral();
    }
  },
  BOOLEAN {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonBoolean;
    }
  },
  ARRAY {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonArray;
    }
  },
  OBJECT {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonObject;
    }
  },
  NULL {
    @Override
    boolean matches(JsonValue value) {
      return value instanceof JsonNull;
    }
  },
  ANY {
    @Override
    boolean matches(JsonValue value) {
      return true;
    }
  };

  abstract boolean matches(JsonValue value);

  String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  static Optional<JsonType> byName(String name) {
    for (JsonType type : values()) {
      if (type.jsonName().equals(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /// The most specific type name of a value, as shown in error messages.
  static String describe(JsonValue value) {
    if (value instanceof JsonNumber number) {
      return number.isIntegral() ? INTEGER.jsonName() : NUMBER.jsonName();
    }
    for (JsonType type : values()) {
      if (type != INTEGER && type != ANY && type.matches(value)) {
        return type.jsonName();
      }
    }
    throw new AssertionError("Unexpected JsonValue type: " + value.getClass());
  }

  @Override
  public String toString() {
    return jsonName();
  }
}
