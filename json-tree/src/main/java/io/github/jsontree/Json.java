package io.github.jsontree;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Factory methods that build [JsonValue] trees.
///
/// JSON text is parsed with Jackson and converted into the sealed value
/// model. Decimal numbers keep their full precision and written scale,
/// duplicate member names and trailing content are rejected.
///
/// ## Example Usage
/// ```java
/// JsonValue doc = Json.parse("{\"id\": 7, \"tags\": [\"a\", \"b\"]}");
/// JsonValue same = Json.of(Map.of("id", 7, "tags", List.of("a", "b")));
/// assert doc.equals(same);
/// ```
public final class Json {

  static final Logger LOG = Logger.getLogger("io.github.jsontree");

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
      .build();

  private Json() {}

  /// Parses JSON text into a value tree.
  ///
  /// @param text the JSON document
  /// @return the parsed value
  /// @throws JsonParseException if `text` is not a single well-formed JSON value
  public static JsonValue parse(String text) {
    Objects.requireNonNull(text, "text");
    final JsonNode node;
    try {
      node = MAPPER.readTree(text);
    } catch (JsonProcessingException e) {
      JsonLocation location = e.getLocation();
      long line = location == null ? -1 : location.getLineNr();
      long column = location == null ? -1 : location.getColumnNr();
      LOG.fine(() -> "parse: failed at line=" + line + " column=" + column + ": " + e.getOriginalMessage());
      throw new JsonParseException(e.getOriginalMessage(), line, column, e);
    }
    if (node == null || node.isMissingNode()) {
      throw new JsonParseException("No JSON content", 1, 1, null);
    }
    return fromJackson(node);
  }

  /// Converts a Jackson tree into a value tree.
  ///
  /// @throws IllegalArgumentException for node types with no JSON equivalent
  public static JsonValue fromJackson(JsonNode node) {
    Objects.requireNonNull(node, "node");
    switch (node.getNodeType()) {
      case NULL:
        return JsonNull.of();
      case BOOLEAN:
        return JsonBoolean.of(node.booleanValue());
      case NUMBER:
        return new JsonNumber(node.decimalValue());
      case STRING:
        return JsonString.of(node.textValue());
      case ARRAY: {
        List<JsonValue> elements = new ArrayList<>(node.size());
        for (JsonNode element : node) {
          elements.add(fromJackson(element));
        }
        return new JsonArray(elements);
      }
      case OBJECT: {
        Map<String, JsonValue> members = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> field = fields.next();
          members.put(field.getKey(), fromJackson(field.getValue()));
        }
        return new JsonObject(members);
      }
      default:
        throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
    }
  }

  /// Converts a plain Java tree into a value tree.
  ///
  /// Accepts `null`, [Boolean], [Number], [CharSequence], [Map] with
  /// string keys, [Iterable], object arrays and existing [JsonValue]s.
  ///
  /// @throws IllegalArgumentException for any other type, non-string map
  ///         keys, or non-finite floating point numbers
  public static JsonValue of(Object source) {
    if (source == null) {
      return JsonNull.of();
    }
    if (source instanceof JsonValue value) {
      return value;
    }
    if (source instanceof Boolean bool) {
      return JsonBoolean.of(bool);
    }
    if (source instanceof Number number) {
      return number(number);
    }
    if (source instanceof CharSequence chars) {
      return JsonString.of(chars.toString());
    }
    if (source instanceof Map<?, ?> map) {
      Map<String, JsonValue> members = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String name)) {
          throw new IllegalArgumentException("Object member names must be strings: " + entry.getKey());
        }
        members.put(name, of(entry.getValue()));
      }
      return new JsonObject(members);
    }
    if (source instanceof Iterable<?> iterable) {
      List<JsonValue> elements = new ArrayList<>();
      for (Object element : iterable) {
        elements.add(of(element));
      }
      return new JsonArray(elements);
    }
    if (source instanceof Object[] array) {
      return of(Arrays.asList(array));
    }
    throw new IllegalArgumentException("No JSON representation for " + source.getClass().getName());
  }

  private static JsonNumber number(Number number) {
    if (number instanceof BigDecimal decimal) {
      return new JsonNumber(decimal);
    }
    if (number instanceof BigInteger integer) {
      return JsonNumber.of(integer);
    }
    if (number instanceof Double || number instanceof Float) {
      return JsonNumber.of(number.doubleValue());
    }
    return JsonNumber.of(number.longValue());
  }
}
