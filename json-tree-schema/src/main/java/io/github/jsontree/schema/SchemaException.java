package io.github.jsontree.schema;

import java.util.Objects;

/// Signals a malformed schema.
///
/// Unlike [ValidationError]s, which describe bad instance data, this
/// exception aborts the `validate` call: the schema itself cannot be
/// interpreted.
public final class SchemaException extends IllegalArgumentException {
  private final Reason reason;
  private final String schemaPointer;

  SchemaException(Reason reason, String schemaPointer, String message) {
    super(message + " at " + schemaPointer);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.schemaPointer = Objects.requireNonNull(schemaPointer, "schemaPointer");
  }

  SchemaException(Reason reason, String schemaPointer, String message, Throwable cause) {
    super(message + " at " + schemaPointer, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
    this.schemaPointer = Objects.requireNonNull(schemaPointer, "schemaPointer");
  }

  public Reason reason() {
    return reason;
  }

  /// {@return the JSON Pointer (`#/properties/a/pattern`) of the offending schema location}
  public String schemaPointer() {
    return schemaPointer;
  }

  public enum Reason {
    NOT_A_SCHEMA,
    UNKNOWN_TYPE,
    UNKNOWN_FORMAT,
    INVALID_PATTERN,
    MALFORMED_KEYWORD,
    UNSUPPORTED_KEYWORD
  }
}
