/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.jsontree.schema;

import io.github.jsontree.JsonValue;

import java.util.List;
import java.util.Objects;

import static io.github.jsontree.schema.SchemaLogging.LOG;

/// JSON Schema public API entry point
///
/// Validates an already parsed [JsonValue] against a schema written in the
/// same value model and reports every violation found, never just the first.
///
/// ## Usage
/// ```java
/// JsonSchemaValidator validator = JsonSchemaValidator.create();
///
/// ValidationResult result = validator.validate(Json.parse(jsonDoc), Json.parse(schemaJson));
///
/// if (!result.valid()) {
///     for (var error : result.errors()) {
///         System.out.println(error.path() + ": " + error.message());
///     }
/// }
/// ```
///
/// The schema is compiled afresh on every call. A malformed schema is
/// reported as a [SchemaException] before the instance is inspected.
/// Instances are never mutated and a validator may be shared between threads.
public final class JsonSchemaValidator {

  private final ValidatorOptions options;

  private JsonSchemaValidator(ValidatorOptions options) {
    this.options = options;
  }

  /// Validator with [ValidatorOptions#DEFAULT]
  public static JsonSchemaValidator create() {
    return create(ValidatorOptions.DEFAULT);
  }

  public static JsonSchemaValidator create(ValidatorOptions options) {
    Objects.requireNonNull(options, "options");
    LOG.fine(() -> "create: " + options.summary());
    return new JsonSchemaValidator(options);
  }

  public ValidatorOptions options() {
    return options;
  }

  /// Validates `instance` against `schema`
  ///
  /// @param instance the data tree to check; JSON null is passed as [io.github.jsontree.JsonNull]
  /// @param schema the schema mapping
  /// @return the outcome with errors in pre-order of the instance tree
  /// @throws SchemaException if the schema is malformed
  public ValidationResult validate(JsonValue instance, JsonValue schema) {
    Objects.requireNonNull(instance, "instance");
    Objects.requireNonNull(schema, "schema");
    StructuredLog.fine(LOG, "validate.start", "instanceType", JsonType.describe(instance));

    SchemaNode root = SchemaCompiler.compile(schema);
    List<ValidationError> errors = new Evaluator(options).run(new ValidationFrame(InstancePath.ROOT, root, instance));

    StructuredLog.fine(LOG, "validate.done", "valid", errors.isEmpty(), "errors", errors.size());
    return ValidationResult.of(errors);
  }
}
