package io.github.jsontree.schema;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/// The closed set of schema keywords understood by the validator.
///
/// Every [ValidationError] names the keyword whose check failed. Keywords
/// such as `properties` or `items` never fail themselves; their failures
/// surface at the child path under the child's own keyword.
public enum Keyword {
  TYPE("type"),
  DISALLOW("disallow"),
  REQUIRED("required"),
  ENUM("enum"),
  PATTERN("pattern"),
  FORMAT("format"),
  MIN_LENGTH("minLength"),
  MAX_LENGTH("maxLength"),
  MINIMUM("minimum"),
  MAXIMUM("maximum"),
  EXCLUSIVE_MINIMUM("exclusiveMinimum"),
  EXCLUSIVE_MAXIMUM("exclusiveMaximum"),
  DIVISIBLE_BY("divisibleBy"),
  PROPERTIES("properties"),
  PATTERN_PROPERTIES("patternProperties"),
  ADDITIONAL_PROPERTIES("additionalProperties"),
  DEPENDENCIES("dependencies"),
  MIN_PROPERTIES("minProperties"),
  MAX_PROPERTIES("maxProperties"),
  ITEMS("items"),
  ADDITIONAL_ITEMS("additionalItems"),
  MIN_ITEMS("minItems"),
  MAX_ITEMS("maxItems"),
  UNIQUE_ITEMS("uniqueItems"),
  ALL_OF("allOf"),
  ANY_OF("anyOf"),
  ONE_OF("oneOf"),
  NOT("not"),
  EXTENDS("extends");

  private static final Map<String, Keyword> BY_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(Keyword::jsonName, Function.identity()));

  private final String jsonName;

  Keyword(String jsonName) {
    this.jsonName = jsonName;
  }

  /// {@return the member name used for this keyword in a schema document}
  public String jsonName() {
    return jsonName;
  }

  /// Looks up a keyword by its schema spelling (case-sensitive).
  public static Optional<Keyword> byName(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  @Override
  public String toString() {
    return jsonName;
  }
}
