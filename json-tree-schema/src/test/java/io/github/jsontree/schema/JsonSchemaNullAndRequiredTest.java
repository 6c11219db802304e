package io.github.jsontree.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaNullAndRequiredTest extends JsonSchemaTestBase {

  @Test
  void requiredNullReportsExactlyOneError() {
    var result = validate("null", """
        {"required": true}
        """);
    assertThat(result.valid()).isFalse();
    assertThat(result.errors()).hasSize(1);
    assertThat(result.errors().get(0).keyword()).isEqualTo(Keyword.REQUIRED);
    assertThat(result.errors().get(0).path().isRoot()).isTrue();
  }

  @Test
  void nullPassesTypedSchemaWhenNotRequired() {
    var result = validate("null", """
        {"type": "string"}
        """);
    assertThat(result.valid()).isTrue();
    assertThat(result.errors()).isEmpty();
  }

  @Test
  void nullSkipsEveryOtherKeyword() {
    var result = validate("null", """
        {"type": "string", "minLength": 3, "enum": ["abc"], "not": {"type": "null"}}
        """);
    assertThat(result.valid()).isTrue();
  }

  @Test
  void requiredNullSkipsEveryOtherKeyword() {
    var result = validate("null", """
        {"type": "string", "required": true, "enum": ["abc"], "allOf": [{"type": "integer"}]}
        """);
    assertThat(result.errors()).extracting(ValidationError::keyword).containsExactly(Keyword.REQUIRED);
  }

  @Test
  void nullPassesSchemaWithoutType() {
    assertThat(validate("null", "{\"enum\": [1, 2]}").valid()).isTrue();
  }

  @Test
  void nullTypeUsesOrdinaryChecking() {
    var result = validate("null", """
        {"type": "null", "enum": [1]}
        """);
    assertThat(result.errors()).extracting(ValidationError::keyword).containsExactly(Keyword.ENUM);
  }

  @Test
  void nullInTypeUnionUsesOrdinaryChecking() {
    var schema = """
        {"type": ["string", "null"], "required": true}
        """;
    assertThat(validate("null", schema).valid()).isTrue();
    assertThat(validate("\"x\"", schema).valid()).isTrue();
    assertThat(validate("1", schema).errors()).extracting(ValidationError::keyword)
        .containsExactly(Keyword.TYPE);
  }

  @Test
  void missingRequiredPropertyFailsAtChildPath() {
    var result = validate("{}", """
        {"properties": {"a": {"type": "integer", "required": true}}}
        """);
    assertThat(result.errors()).hasSize(1);
    ValidationError error = result.errors().get(0);
    assertThat(error.path()).isEqualTo(InstancePath.of("a"));
    assertThat(error.keyword()).isEqualTo(Keyword.REQUIRED);
  }

  @Test
  void explicitNullPropertyCountsAsMissing() {
    var result = validate("{\"a\": null}", """
        {"properties": {"a": {"type": "integer", "required": true}}}
        """);
    assertThat(result.errors()).extracting(ValidationError::keyword).containsExactly(Keyword.REQUIRED);
  }

  @Test
  void optionalPropertyMayBeAbsent() {
    var result = validate("{}", """
        {"properties": {"a": {"type": "integer", "minimum": 5}}}
        """);
    assertThat(result.valid()).isTrue();
  }

  @Test
  void requiredFalseIsTheDefault() {
    assertThat(validate("null", "{\"required\": false, \"type\": \"object\"}").valid()).isTrue();
  }

  @Test
  void requiredAsNameListReportsEachMissingName() {
    var result = validate("{\"b\": 1}", """
        {"type": "object", "required": ["a", "b", "c"]}
        """);
    assertThat(result.errors()).extracting(ValidationError::path)
        .containsExactly(InstancePath.of("a"), InstancePath.of("c"));
    assertThat(result.errors()).extracting(ValidationError::keyword)
        .containsOnly(Keyword.REQUIRED);
    assertThat(result.errors().get(0).message()).isEqualTo("Missing required property: a");
  }

  @Test
  void propertyRequiredTwiceReportsOnce() {
    var result = validate("{}", """
        {"required": ["a"], "properties": {"a": {"required": true}}}
        """);
    assertThat(result.errors()).singleElement().satisfies(error -> {
      assertThat(error.path()).isEqualTo(InstancePath.of("a"));
      assertThat(error.keyword()).isEqualTo(Keyword.REQUIRED);
      assertThat(error.message()).isEqualTo("Required value is missing or null");
    });
  }

  @Test
  void nameListStillReportsPropertyThatAdmitsNull() {
    var result = validate("{}", """
        {"required": ["a"], "properties": {"a": {"type": ["integer", "null"], "required": true}}}
        """);
    assertThat(result.errors()).singleElement().satisfies(error -> {
      assertThat(error.path()).isEqualTo(InstancePath.of("a"));
      assertThat(error.message()).isEqualTo("Missing required property: a");
    });
  }
}
