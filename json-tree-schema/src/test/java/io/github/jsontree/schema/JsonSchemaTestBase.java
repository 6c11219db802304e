package io.github.jsontree.schema;

import io.github.jsontree.Json;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// Base class for schema tests.
/// - Emits an INFO banner per test.
/// - Validates JSON text against JSON text with a default validator.
class JsonSchemaTestBase extends JsonSchemaLoggingConfig {

  static final JsonSchemaValidator VALIDATOR = JsonSchemaValidator.create();

  @BeforeEach
  void announce(TestInfo testInfo) {
    final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
    final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
        .orElseGet(testInfo::getDisplayName);
    LOG.info(() -> "TEST: " + cls + "#" + name);
  }

  static ValidationResult validate(String instanceJson, String schemaJson) {
    return VALIDATOR.validate(Json.parse(instanceJson), Json.parse(schemaJson));
  }
}
