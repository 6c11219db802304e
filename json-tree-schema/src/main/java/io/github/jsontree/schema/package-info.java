/// Schema validation for [io.github.jsontree.JsonValue] trees.
///
/// [io.github.jsontree.schema.JsonSchemaValidator] is the entry point. It
/// compiles the schema for each call, walks the instance with an explicit
/// work stack and returns a [io.github.jsontree.schema.ValidationResult]
/// listing every violation with its [io.github.jsontree.schema.InstancePath].
package io.github.jsontree.schema;
