package io.github.jsontree.schema;

import io.github.jsontree.JsonArray;
import io.github.jsontree.JsonBoolean;
import io.github.jsontree.JsonNumber;
import io.github.jsontree.JsonObject;
import io.github.jsontree.JsonString;
import io.github.jsontree.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// Turns a schema document into a tree of [SchemaNode]s for one validation.
///
/// Every keyword value is checked for shape here, so a malformed schema is
/// rejected with a [SchemaException] before any instance data is looked at.
/// Unknown members (`title`, `description`, `default`, ...) are ignored.
final class SchemaCompiler {
  static final String ROOT_POINTER = "#";

  private SchemaCompiler() {}

  static SchemaNode compile(JsonValue schemaJson) {
    LOG.fine(() -> "compile: Starting schema compilation, schema type: " + schemaJson.getClass().getSimpleName());
    SchemaNode root = compileNode(schemaJson, ROOT_POINTER);
    LOG.fine(() -> "compile: Completed schema compilation, root validators: " + root.pipeline().size());
    return root;
  }

  static SchemaNode compileNode(JsonValue schemaJson, String pointer) {
    if (!(schemaJson instanceof JsonObject obj)) {
      throw fail(SchemaException.Reason.NOT_A_SCHEMA, pointer,
          "Schema must be an object, found " + JsonType.describe(schemaJson));
    }
    Map<String, JsonValue> members = obj.members();

    if (members.containsKey("$ref")) {
      throw fail(SchemaException.Reason.UNSUPPORTED_KEYWORD, child(pointer, "$ref"), "$ref is not supported");
    }

    List<JsonType> types = typeList(members, Keyword.TYPE, pointer);
    List<JsonType> disallowed = typeList(members, Keyword.DISALLOW, pointer);

    boolean required = false;
    List<String> requiredNames = List.of();
    JsonValue requiredValue = members.get(Keyword.REQUIRED.jsonName());
    if (requiredValue instanceof JsonBoolean flag) {
      required = flag.value();
    } else if (requiredValue instanceof JsonArray) {
      requiredNames = stringList(requiredValue, child(pointer, Keyword.REQUIRED.jsonName()));
    } else if (requiredValue != null) {
      throw malformed(pointer, Keyword.REQUIRED, "must be a boolean or an array of property names");
    }

    boolean exclusiveMinimum = flag(members, Keyword.EXCLUSIVE_MINIMUM, pointer);
    boolean exclusiveMaximum = flag(members, Keyword.EXCLUSIVE_MAXIMUM, pointer);

    List<KeywordValidator> pipeline = new ArrayList<>();
    if (!types.isEmpty() || !disallowed.isEmpty()) {
      pipeline.add(new TypeKeyword(types, disallowed));
    }
    JsonValue enumValue = members.get(Keyword.ENUM.jsonName());
    if (enumValue != null) {
      if (!(enumValue instanceof JsonArray enumArray)) {
        throw malformed(pointer, Keyword.ENUM, "must be an array");
      }
      pipeline.add(new EnumKeyword(enumArray.elements()));
    }
    addIfPresent(pipeline, compileStringKeywords(members, pointer, exclusiveMinimum, exclusiveMaximum));
    addIfPresent(pipeline, compileNumberKeywords(members, pointer, exclusiveMinimum, exclusiveMaximum));
    addIfPresent(pipeline, compileObjectKeywords(members, pointer, requiredNames));
    addIfPresent(pipeline, compileArrayKeywords(members, pointer, exclusiveMinimum, exclusiveMaximum));
    addIfPresent(pipeline, compileCompositionKeywords(members, pointer));

    boolean admitsNull = types.contains(JsonType.NULL);
    StructuredLog.finer(LOG, "compile.node", "pointer", pointer, "validators", pipeline.size(),
        "required", required, "admitsNull", admitsNull);
    return new SchemaNode(pointer, required, admitsNull, pipeline);
  }

  private static void addIfPresent(List<KeywordValidator> pipeline, KeywordValidator validator) {
    if (validator != null) {
      pipeline.add(validator);
    }
  }

  /// String schema compilation
  private static StringKeywords compileStringKeywords(Map<String, JsonValue> members, String pointer,
                                                      boolean exclusiveMinimum, boolean exclusiveMaximum) {
    Integer minLength = count(members, Keyword.MIN_LENGTH, pointer);
    Integer maxLength = count(members, Keyword.MAX_LENGTH, pointer);

    Pattern pattern = null;
    JsonValue patternValue = members.get(Keyword.PATTERN.jsonName());
    if (patternValue != null) {
      if (!(patternValue instanceof JsonString patternStr)) {
        throw malformed(pointer, Keyword.PATTERN, "must be a string");
      }
      pattern = regex(patternStr.value(), child(pointer, Keyword.PATTERN.jsonName()));
    }

    Format format = null;
    JsonValue formatValue = members.get(Keyword.FORMAT.jsonName());
    if (formatValue != null) {
      if (!(formatValue instanceof JsonString formatStr)) {
        throw malformed(pointer, Keyword.FORMAT, "must be a string");
      }
      format = Format.byName(formatStr.value()).orElseThrow(() -> fail(SchemaException.Reason.UNKNOWN_FORMAT,
          child(pointer, Keyword.FORMAT.jsonName()), "Unknown format '" + formatStr.value() + "'"));
    }

    if (minLength == null && maxLength == null && pattern == null && format == null) {
      return null;
    }
    return new StringKeywords(minLength, maxLength, exclusiveMinimum, exclusiveMaximum, pattern, format);
  }

  /// Number schema compilation
  private static NumberKeywords compileNumberKeywords(Map<String, JsonValue> members, String pointer,
                                                      boolean exclusiveMinimum, boolean exclusiveMaximum) {
    BigDecimal minimum = decimal(members, Keyword.MINIMUM, pointer);
    BigDecimal maximum = decimal(members, Keyword.MAXIMUM, pointer);
    BigDecimal divisibleBy = decimal(members, Keyword.DIVISIBLE_BY, pointer);
    if (divisibleBy != null && divisibleBy.signum() <= 0) {
      throw malformed(pointer, Keyword.DIVISIBLE_BY, "must be greater than zero");
    }

    if (minimum == null && maximum == null && divisibleBy == null) {
      return null;
    }
    return new NumberKeywords(minimum, maximum, exclusiveMinimum, exclusiveMaximum, divisibleBy);
  }

  /// Object schema compilation
  private static ObjectKeywords compileObjectKeywords(Map<String, JsonValue> members, String pointer,
                                                      List<String> requiredNames) {
    Map<String, SchemaNode> properties = new LinkedHashMap<>();
    JsonObject propsObj = schemaMap(members, Keyword.PROPERTIES, pointer);
    if (propsObj != null) {
      String propsPointer = child(pointer, Keyword.PROPERTIES.jsonName());
      for (var entry : propsObj.members().entrySet()) {
        properties.put(entry.getKey(), compileNode(entry.getValue(), child(propsPointer, entry.getKey())));
      }
    }

    List<ObjectKeywords.PatternProperty> patternProperties = new ArrayList<>();
    JsonObject patternPropsObj = schemaMap(members, Keyword.PATTERN_PROPERTIES, pointer);
    if (patternPropsObj != null) {
      String patternsPointer = child(pointer, Keyword.PATTERN_PROPERTIES.jsonName());
      for (var entry : patternPropsObj.members().entrySet()) {
        String entryPointer = child(patternsPointer, entry.getKey());
        Pattern pattern = regex(entry.getKey(), entryPointer);
        patternProperties.add(new ObjectKeywords.PatternProperty(pattern, compileNode(entry.getValue(), entryPointer)));
      }
    }

    AdditionalPolicy additionalProperties = AdditionalPolicy.ALLOW;
    JsonValue addPropsValue = members.get(Keyword.ADDITIONAL_PROPERTIES.jsonName());
    String addPropsPointer = child(pointer, Keyword.ADDITIONAL_PROPERTIES.jsonName());
    if (addPropsValue instanceof JsonBoolean addPropsBool) {
      additionalProperties = addPropsBool.value() ? AdditionalPolicy.ALLOW : AdditionalPolicy.DENY;
    } else if (addPropsValue instanceof JsonArray) {
      additionalProperties = new AdditionalPolicy.AllowList(
          new LinkedHashSet<>(stringList(addPropsValue, addPropsPointer)));
    } else if (addPropsValue instanceof JsonObject) {
      additionalProperties = new AdditionalPolicy.Constrained(compileNode(addPropsValue, addPropsPointer));
    } else if (addPropsValue != null) {
      throw malformed(pointer, Keyword.ADDITIONAL_PROPERTIES, "must be a boolean, an array of names or a schema");
    }

    Map<String, Dependency> dependencies = new LinkedHashMap<>();
    JsonValue depsValue = members.get(Keyword.DEPENDENCIES.jsonName());
    if (depsValue != null) {
      if (!(depsValue instanceof JsonObject depsObj)) {
        throw malformed(pointer, Keyword.DEPENDENCIES, "must be an object");
      }
      String depsPointer = child(pointer, Keyword.DEPENDENCIES.jsonName());
      for (var entry : depsObj.members().entrySet()) {
        String entryPointer = child(depsPointer, entry.getKey());
        JsonValue depValue = entry.getValue();
        Dependency dependency;
        if (depValue instanceof JsonString single) {
          dependency = new Dependency.OnProperties(List.of(single.value()));
        } else if (depValue instanceof JsonArray) {
          dependency = new Dependency.OnProperties(stringList(depValue, entryPointer));
        } else if (depValue instanceof JsonObject) {
          dependency = new Dependency.OnSchema(compileNode(depValue, entryPointer));
        } else {
          throw fail(SchemaException.Reason.MALFORMED_KEYWORD, entryPointer,
              "dependencies values must be a property name, an array of names or a schema");
        }
        dependencies.put(entry.getKey(), dependency);
      }
    }

    Integer minProperties = count(members, Keyword.MIN_PROPERTIES, pointer);
    Integer maxProperties = count(members, Keyword.MAX_PROPERTIES, pointer);

    if (propsObj == null && patternPropsObj == null && addPropsValue == null && depsValue == null
        && requiredNames.isEmpty() && minProperties == null && maxProperties == null) {
      return null;
    }
    return new ObjectKeywords(properties, patternProperties, additionalProperties, requiredNames,
        dependencies, minProperties, maxProperties);
  }

  /// Array schema compilation
  private static ArrayKeywords compileArrayKeywords(Map<String, JsonValue> members, String pointer,
                                                    boolean exclusiveMinimum, boolean exclusiveMaximum) {
    SchemaNode items = null;
    List<SchemaNode> tupleItems = null;
    JsonValue itemsValue = members.get(Keyword.ITEMS.jsonName());
    String itemsPointer = child(pointer, Keyword.ITEMS.jsonName());
    if (itemsValue instanceof JsonObject) {
      items = compileNode(itemsValue, itemsPointer);
    } else if (itemsValue instanceof JsonArray itemsArray) {
      tupleItems = compileList(itemsArray, itemsPointer);
    } else if (itemsValue != null) {
      throw malformed(pointer, Keyword.ITEMS, "must be a schema or an array of schemas");
    }

    // positional items reject extra elements unless additionalItems says otherwise
    AdditionalPolicy additionalItems = AdditionalPolicy.DENY;
    JsonValue addItemsValue = members.get(Keyword.ADDITIONAL_ITEMS.jsonName());
    if (addItemsValue instanceof JsonBoolean addItemsBool) {
      additionalItems = addItemsBool.value() ? AdditionalPolicy.ALLOW : AdditionalPolicy.DENY;
    } else if (addItemsValue instanceof JsonObject) {
      additionalItems = new AdditionalPolicy.Constrained(
          compileNode(addItemsValue, child(pointer, Keyword.ADDITIONAL_ITEMS.jsonName())));
    } else if (addItemsValue != null) {
      throw malformed(pointer, Keyword.ADDITIONAL_ITEMS, "must be a boolean or a schema");
    }
    if (tupleItems == null && addItemsValue != null) {
      LOG.finer(() -> "compile: additionalItems ignored without positional items at " + pointer);
    }

    Integer minItems = count(members, Keyword.MIN_ITEMS, pointer);
    Integer maxItems = count(members, Keyword.MAX_ITEMS, pointer);
    boolean uniqueItems = flag(members, Keyword.UNIQUE_ITEMS, pointer);

    if (itemsValue == null && minItems == null && maxItems == null && !uniqueItems) {
      return null;
    }
    return new ArrayKeywords(items, tupleItems, additionalItems, minItems, maxItems,
        exclusiveMinimum, exclusiveMaximum, uniqueItems);
  }

  /// Composition keyword compilation
  private static CompositionKeywords compileCompositionKeywords(Map<String, JsonValue> members, String pointer) {
    List<SchemaNode> allOf = schemaArray(members, Keyword.ALL_OF, pointer);
    List<SchemaNode> anyOf = schemaArray(members, Keyword.ANY_OF, pointer);
    List<SchemaNode> oneOf = schemaArray(members, Keyword.ONE_OF, pointer);
    List<SchemaNode> not = schemaOrArray(members, Keyword.NOT, pointer);
    List<SchemaNode> extendsSchemas = schemaOrArray(members, Keyword.EXTENDS, pointer);

    if (allOf == null && anyOf == null && oneOf == null && not == null && extendsSchemas == null) {
      return null;
    }
    return new CompositionKeywords(allOf, extendsSchemas, anyOf, oneOf, not);
  }

  /// A non-empty array of schemas, or null when the keyword is absent
  private static List<SchemaNode> schemaArray(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonArray array) || array.elements().isEmpty()) {
      throw malformed(pointer, keyword, "must be a non-empty array of schemas");
    }
    return compileList(array, child(pointer, keyword.jsonName()));
  }

  /// A schema or a non-empty array of schemas, or null when the keyword is absent
  private static List<SchemaNode> schemaOrArray(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return null;
    }
    if (value instanceof JsonObject) {
      return List.of(compileNode(value, child(pointer, keyword.jsonName())));
    }
    if (!(value instanceof JsonArray array) || array.elements().isEmpty()) {
      throw malformed(pointer, keyword, "must be a schema or a non-empty array of schemas");
    }
    return compileList(array, child(pointer, keyword.jsonName()));
  }

  private static List<SchemaNode> compileList(JsonArray array, String pointer) {
    List<SchemaNode> schemas = new ArrayList<>(array.elements().size());
    for (int i = 0; i < array.elements().size(); i++) {
      schemas.add(compileNode(array.elements().get(i), child(pointer, Integer.toString(i))));
    }
    return schemas;
  }

  private static JsonObject schemaMap(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonObject obj)) {
      throw malformed(pointer, keyword, "must be an object mapping names to schemas");
    }
    return obj;
  }

  /// `type` / `disallow`: a type name or an array of type names
  private static List<JsonType> typeList(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return List.of();
    }
    String keywordPointer = child(pointer, keyword.jsonName());
    if (value instanceof JsonString name) {
      return List.of(typeByName(name.value(), keywordPointer));
    }
    if (value instanceof JsonArray array && !array.elements().isEmpty()) {
      List<JsonType> types = new ArrayList<>();
      for (int i = 0; i < array.elements().size(); i++) {
        JsonValue item = array.elements().get(i);
        if (!(item instanceof JsonString name)) {
          throw fail(SchemaException.Reason.MALFORMED_KEYWORD, child(keywordPointer, Integer.toString(i)),
              "Type array must contain only strings");
        }
        types.add(typeByName(name.value(), child(keywordPointer, Integer.toString(i))));
      }
      return types;
    }
    throw malformed(pointer, keyword, "must be a type name or a non-empty array of type names");
  }

  private static JsonType typeByName(String name, String pointer) {
    return JsonType.byName(name).orElseThrow(() ->
        fail(SchemaException.Reason.UNKNOWN_TYPE, pointer, "Unknown type '" + name + "'"));
  }

  private static List<String> stringList(JsonValue value, String pointer) {
    List<String> names = new ArrayList<>();
    for (JsonValue item : ((JsonArray) value).elements()) {
      if (!(item instanceof JsonString str)) {
        throw fail(SchemaException.Reason.MALFORMED_KEYWORD, pointer, "Expected an array of strings");
      }
      names.add(str.value());
    }
    return names;
  }

  private static Pattern regex(String regex, String pointer) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      LOG.severe(() -> "ERROR: SCHEMA: invalid regular expression '" + regex + "' at " + pointer);
      throw new SchemaException(SchemaException.Reason.INVALID_PATTERN, pointer,
          "Invalid regular expression '" + regex + "': " + e.getDescription(), e);
    }
  }

  private static boolean flag(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return false;
    }
    if (!(value instanceof JsonBoolean bool)) {
      throw malformed(pointer, keyword, "must be a boolean");
    }
    return bool.value();
  }

  private static BigDecimal decimal(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    JsonValue value = members.get(keyword.jsonName());
    if (value == null) {
      return null;
    }
    if (!(value instanceof JsonNumber number)) {
      throw malformed(pointer, keyword, "must be a number");
    }
    return number.value();
  }

  /// A non-negative integer that fits an `int`
  private static Integer count(Map<String, JsonValue> members, Keyword keyword, String pointer) {
    BigDecimal value = decimal(members, keyword, pointer);
    if (value == null) {
      return null;
    }
    if (value.signum() < 0 || !new JsonNumber(value).isIntegral()) {
      throw malformed(pointer, keyword, "must be a non-negative integer");
    }
    try {
      return value.intValueExact();
    } catch (ArithmeticException e) {
      return Integer.MAX_VALUE;
    }
  }

  /// Appends one reference token to a JSON Pointer, escaping per RFC 6901
  static String child(String pointer, String token) {
    return pointer + "/" + token.replace("~", "~0").replace("/", "~1");
  }

  private static SchemaException malformed(String pointer, Keyword keyword, String detail) {
    return fail(SchemaException.Reason.MALFORMED_KEYWORD, child(pointer, keyword.jsonName()),
        keyword.jsonName() + " " + detail);
  }

  private static SchemaException fail(SchemaException.Reason reason, String pointer, String message) {
    LOG.severe(() -> "ERROR: SCHEMA: " + reason + " " + message + " at " + pointer);
    return new SchemaException(reason, pointer, message);
  }
}
